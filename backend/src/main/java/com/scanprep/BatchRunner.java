package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnNotWebApplication;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line batch mode. Exit code 0 when every file succeeded or was skipped,
 * 1 when any file failed, 2 for configuration errors.
 */
@Component
@ConditionalOnNotWebApplication
public class BatchRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FILE_FAILURES = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private final PreprocessPipeline pipeline;
    private final PreprocessProperties properties;
    private int exitCode = EXIT_OK;

    public BatchRunner(PreprocessPipeline pipeline, PreprocessProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    int execute(String[] args) {
        CommandLineOptions options;
        RunSummary summary;
        try {
            options = CommandLineOptions.parse(args);
            if (options.isHelp()) {
                System.out.println(CommandLineOptions.USAGE);
                return EXIT_OK;
            }
            PreprocessConfig config = options.applyTo(properties.toConfigBuilder()).build();
            if (options.isResetCache()) {
                pipeline.resetCache(options.getSource());
            }
            summary = pipeline.run(config, options.getSource(), options.getDestination(),
                    (outcome, completed, total) -> log.info("[{}/{}] {}", completed, total, outcome));
        } catch (ConfigException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.err.println(CommandLineOptions.USAGE);
            return EXIT_CONFIG_ERROR;
        }

        String report = options.getReport() != null ? options.getReport() : properties.getReportFile();
        if (report != null && !report.isBlank()) {
            Path reportPath = Paths.get(report);
            try {
                summary.writeReport(reportPath);
                log.info("Run report written to {}", reportPath);
            } catch (IOException e) {
                log.error("Could not write run report {}: {}", reportPath, e.getMessage());
                return EXIT_FILE_FAILURES;
            }
        }
        return summary.hasFailures() ? EXIT_FILE_FAILURES : EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
