package com.scanprep;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Quality model run as a subprocess, for example a small wrapper script around an IQA toolkit.
 * The image is handed over as a temporary PNG in place of {@code {input}}; the score is the
 * last number printed on the last non-blank output line.
 */
public class CommandQualityModel implements QualityModel {

    static final String INPUT = "{input}";

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private final String commandTemplate;
    private final Duration timeout;

    public CommandQualityModel(String commandTemplate, Duration timeout) {
        ExternalCommand.expand(commandTemplate, Map.of(INPUT, "probe"));
        this.commandTemplate = commandTemplate;
        this.timeout = timeout;
    }

    @Override
    public double assess(BufferedImage image) throws IOException, InterruptedException {
        Path input = Files.createTempFile("scanprep-iqa-", ".png");
        try {
            ImageIO.write(image, "png", input.toFile());
            List<String> command = ExternalCommand.expand(commandTemplate, Map.of(INPUT, input.toString()));
            return parseScore(ExternalCommand.run(command, timeout));
        } finally {
            Files.deleteIfExists(input);
        }
    }

    static double parseScore(String output) throws IOException {
        String lastLine = null;
        for (String line : output.split("\\R")) {
            if (!line.isBlank()) lastLine = line;
        }
        if (lastLine == null) {
            throw new IOException("Quality command printed nothing");
        }
        Matcher m = NUMBER.matcher(lastLine);
        String last = null;
        while (m.find()) {
            last = m.group();
        }
        if (last == null) {
            throw new IOException("No score in quality command output: " + lastLine.strip());
        }
        return Double.parseDouble(last);
    }
}
