package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external model command built from a template such as
 * {@code "sbb_binarize --patches -m /models/sbb {input} {output}"}.
 * Placeholders are substituted per token after splitting, so paths with spaces stay intact.
 */
final class ExternalCommand {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommand.class);

    private static final int OUTPUT_TAIL_CHARS = 500;

    private ExternalCommand() {}

    /**
     * Splits the template on whitespace (double quotes group) and substitutes placeholders.
     *
     * @throws ConfigException if the template is blank or lacks a required placeholder
     */
    static List<String> expand(String template, Map<String, String> placeholders) {
        if (template == null || template.isBlank()) {
            throw new ConfigException("External model command is not configured");
        }
        for (String key : placeholders.keySet()) {
            if (!template.contains(key)) {
                throw new ConfigException("Command template '" + template + "' must contain " + key);
            }
        }
        List<String> tokens = splitCommand(template);
        List<String> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            String t = token;
            for (Map.Entry<String, String> e : placeholders.entrySet()) {
                t = t.replace(e.getKey(), e.getValue());
            }
            out.add(t);
        }
        return out;
    }

    static List<String> splitCommand(String cmd) {
        List<String> out = new ArrayList<>();
        boolean inQuote = false;
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < cmd.length(); i++) {
            char c = cmd.charAt(i);
            if (c == '"') {
                inQuote = !inQuote;
            } else if (Character.isWhitespace(c) && !inQuote) {
                if (cur.length() > 0) { out.add(cur.toString()); cur.setLength(0); }
            } else {
                cur.append(c);
            }
        }
        if (cur.length() > 0) out.add(cur.toString());
        return out;
    }

    /**
     * Runs the command to completion and returns its combined stdout/stderr.
     *
     * @throws IOException if the process cannot start, exits non-zero or exceeds the timeout
     */
    static String run(List<String> command, Duration timeout) throws IOException, InterruptedException {
        Path output = Files.createTempFile("scanprep-cmd-", ".log");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            log.debug("Running {}", command);
            Process process = pb.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Command " + command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            // Model logs are not always valid UTF-8; malformed bytes become U+FFFD
            String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IOException("Command " + command.get(0) + " exited with " + process.exitValue()
                        + ": " + tail(text));
            }
            return text;
        } finally {
            Files.deleteIfExists(output);
        }
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= OUTPUT_TAIL_CHARS
                ? trimmed
                : "..." + trimmed.substring(trimmed.length() - OUTPUT_TAIL_CHARS);
    }
}
