package com.scanprep;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch command line: {@code source_dir dest_dir [options]}. Options accept both
 * {@code --name value} and {@code --name=value}; Spring's own {@code --key=value}
 * properties pass through untouched.
 */
public final class CommandLineOptions {

    static final String USAGE = String.join("\n",
            "Usage: scanprep <source_dir> <dest_dir> [options]",
            "",
            "Scores every image in source_dir, routes high-quality images to the learned binarizer",
            "and low-quality ones to Sauvola thresholding, deskews the result and writes it to dest_dir.",
            "",
            "Options:",
            "  -k,  --k_val, --sauv_k_val <k>            Sauvola k (default 0.24)",
            "  -w,  --window_size, --sauv_window_size <n> Sauvola window size, odd (default 11)",
            "  -ce, --contrast_enhance                    Contrast stretch and CLAHE before binarization",
            "  -r,  -re, --regex <pattern>                Only fully process files whose name matches;",
            "                                             the others are normalized only",
            "  -gb, --goodbad_threshold <t>               Scores >= t use the learned binarizer (default 0.335)",
            "  -lb, --lower_better                        Quality metric where lower scores are better",
            "  -rc, --reset_cache                         Delete cached scores before the run",
            "       --na_as_bad                           Send images without a score to Sauvola instead of skipping",
            "       --report <file>                       Write a JSON run report",
            "  -h,  --help                                Show this help");

    private Path source;
    private Path destination;
    private Double sauvolaK;
    private Integer sauvolaWindow;
    private boolean contrastEnhance;
    private String regex;
    private Double goodBadThreshold;
    private boolean lowerBetter;
    private boolean resetCache;
    private boolean naAsBad;
    private String report;
    private boolean help;

    private CommandLineOptions() {}

    /**
     * True when the arguments ask for a batch run rather than the API server.
     */
    public static boolean isBatchInvocation(String[] args) {
        for (String arg : args) {
            if (!arg.startsWith("-") || arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    /**
     * @throws ConfigException on unknown options, malformed values or missing directories
     */
    public static CommandLineOptions parse(String[] args) {
        CommandLineOptions o = new CommandLineOptions();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inlineValue = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inlineValue = arg.substring(eq + 1);
            }

            switch (name) {
                case "-h":
                case "--help":
                    o.help = true;
                    break;
                case "-k":
                case "--k_val":
                case "--sauv_k_val":
                    o.sauvolaK = parseDouble(name, inlineValue != null ? inlineValue : value(args, ++i, name));
                    break;
                case "-w":
                case "--window_size":
                case "--sauv_window_size":
                    o.sauvolaWindow = parseInt(name, inlineValue != null ? inlineValue : value(args, ++i, name));
                    break;
                case "-ce":
                case "--contrast_enhance":
                    o.contrastEnhance = true;
                    break;
                case "-r":
                case "-re":
                case "--regex":
                    o.regex = inlineValue != null ? inlineValue : value(args, ++i, name);
                    break;
                case "-gb":
                case "--goodbad_threshold":
                    o.goodBadThreshold = parseDouble(name, inlineValue != null ? inlineValue : value(args, ++i, name));
                    break;
                case "-lb":
                case "--lower_better":
                    o.lowerBetter = true;
                    break;
                case "-rc":
                case "--reset_cache":
                    o.resetCache = true;
                    break;
                case "--na_as_bad":
                    o.naAsBad = true;
                    break;
                case "--report":
                    o.report = inlineValue != null ? inlineValue : value(args, ++i, name);
                    break;
                default:
                    if (arg.startsWith("--") && eq > 0) {
                        // Spring property such as --server.port=8081
                        break;
                    }
                    if (arg.startsWith("-")) {
                        throw new ConfigException("Unknown option " + arg);
                    }
                    positional.add(arg);
            }
        }

        if (o.help) {
            return o;
        }
        if (positional.size() != 2) {
            throw new ConfigException("Expected <source_dir> <dest_dir>, got " + positional.size() + " positional argument(s)");
        }
        o.source = Paths.get(positional.get(0));
        o.destination = Paths.get(positional.get(1));
        return o;
    }

    /**
     * Overlays the options given on the command line onto {@code builder}.
     */
    public PreprocessConfig.Builder applyTo(PreprocessConfig.Builder builder) {
        if (sauvolaK != null) builder.sauvolaK(sauvolaK);
        if (sauvolaWindow != null) builder.sauvolaWindow(sauvolaWindow);
        if (contrastEnhance) builder.contrastEnhance(true);
        if (regex != null) builder.selectionRegex(regex);
        if (goodBadThreshold != null) builder.goodBadThreshold(goodBadThreshold);
        if (lowerBetter) builder.lowerIsBetter(true);
        if (naAsBad) builder.scoreUnavailablePolicy(PreprocessConfig.ScoreUnavailablePolicy.TREAT_AS_BAD);
        return builder;
    }

    private static String value(String[] args, int i, String name) {
        if (i >= args.length) {
            throw new ConfigException("Option " + name + " needs a value");
        }
        return args[i];
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("Option " + name + " expects a number, got '" + value + "'", e);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigException("Option " + name + " expects an integer, got '" + value + "'", e);
        }
    }

    public Path getSource() { return source; }
    public Path getDestination() { return destination; }
    public boolean isResetCache() { return resetCache; }
    public String getReport() { return report; }
    public boolean isHelp() { return help; }
}
