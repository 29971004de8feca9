package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes every image through normalization, quality scoring, classification, the
 * branch binarizer picked by the classification, and deskewing.
 * <p>
 * GOOD images go to the learned binarizer, BAD images to Sauvola; both share the
 * same enhancement and deskew stages. A failure only affects its own file: the run
 * records it and continues. Scores are read from and written to a {@link ScoreCache}
 * kept in the source directory, so re-running over the same tree never calls the
 * quality model twice for one image.
 */
public class PreprocessPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreprocessPipeline.class);

    private final QualityModel qualityModel;
    private final ModelCallExecutor modelCalls;
    private final MlBinarizerAdapter mlBinarizer;
    private final GrayscaleEnhancer enhancer = new GrayscaleEnhancer();
    private final int workerThreads;
    private final String cacheFileName;
    private final String outputFormat;
    private final Set<AtomicBoolean> activeRuns = ConcurrentHashMap.newKeySet();

    /**
     * @param workerThreads files processed in parallel, 0 for one per available processor
     * @param cacheFileName score cache file name, created in the source directory
     * @param outputFormat ImageIO format name of the written files, also their extension
     */
    public PreprocessPipeline(QualityModel qualityModel, BinarizationModel binarizationModel,
                              ModelCallExecutor modelCalls, int workerThreads,
                              String cacheFileName, String outputFormat) {
        if (workerThreads < 0) {
            throw new ConfigException("Worker threads must not be negative, got " + workerThreads);
        }
        if (!ImageIO.getImageWritersByFormatName(outputFormat).hasNext()) {
            throw new ConfigException("No image writer for output format '" + outputFormat + "'");
        }
        this.qualityModel = qualityModel;
        this.modelCalls = modelCalls;
        this.mlBinarizer = new MlBinarizerAdapter(binarizationModel, modelCalls);
        this.workerThreads = workerThreads;
        this.cacheFileName = cacheFileName;
        this.outputFormat = outputFormat;
    }

    /**
     * Processes every image under {@code sourceRoot} into {@code destRoot}.
     *
     * @throws ConfigException if the directories are unusable; nothing is processed then
     */
    public RunSummary run(PreprocessConfig config, Path sourceRoot, Path destRoot, ProgressListener listener) {
        checkDirectories(sourceRoot, destRoot);
        List<Path> inputs;
        try {
            inputs = ImageFiles.list(sourceRoot, destRoot);
        } catch (IOException e) {
            throw new ConfigException("Cannot list source directory " + sourceRoot + ": " + e.getMessage(), e);
        }
        return run(config, sourceRoot, inputs, destRoot, listener);
    }

    public RunSummary run(PreprocessConfig config, Path sourceRoot, List<Path> inputs, Path destRoot,
                          ProgressListener listener) {
        long start = System.nanoTime();
        AtomicBoolean cancelled = new AtomicBoolean();
        activeRuns.add(cancelled);

        Map<Classification, Binarizer> binarizers = new EnumMap<>(Classification.class);
        binarizers.put(Classification.GOOD, mlBinarizer);
        binarizers.put(Classification.BAD, new SauvolaBinarizer(config));
        Deskewer deskewer = new Deskewer(config);
        UploadNormalizer normalizer = new UploadNormalizer(config.getMaxDimension());

        int threads = workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
        threads = Math.max(1, Math.min(threads, inputs.size()));
        AtomicInteger threadIds = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads,
                r -> new Thread(r, "preprocess-" + threadIds.incrementAndGet()));

        log.info("Processing {} images from {} into {} with {} workers ({})",
                inputs.size(), sourceRoot, destRoot, threads, config);

        Map<Path, String> collisions = outputCollisions(sourceRoot, inputs, destRoot);

        List<FileOutcome> outcomes = new ArrayList<>(inputs.size());
        int cacheWriteFailures;
        try (ScoreCache cache = ScoreCache.open(sourceRoot.resolve(cacheFileName))) {
            AtomicInteger completed = new AtomicInteger();
            List<Future<FileOutcome>> futures = new ArrayList<>(inputs.size());
            for (Path input : inputs) {
                String collision = collisions.get(input);
                futures.add(pool.submit(() -> {
                    FileOutcome outcome;
                    if (cancelled.get()) {
                        outcome = FileOutcome.cancelled(input);
                    } else if (collision != null) {
                        outcome = FileOutcome.failed(input, FileStage.SELECTED, null, null, collision);
                    } else {
                        outcome = processFile(config, sourceRoot, input, destRoot, cache, binarizers, deskewer, normalizer);
                    }
                    listener.onFileDone(outcome, completed.incrementAndGet(), inputs.size());
                    return outcome;
                }));
            }
            pool.shutdown();

            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.error("Worker crashed on {}", inputs.get(i), e.getCause());
                    outcomes.add(FileOutcome.failed(inputs.get(i), FileStage.SELECTED, null, null,
                            String.valueOf(e.getCause())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancelled.set(true);
                    outcomes.add(FileOutcome.cancelled(inputs.get(i)));
                }
            }
            cacheWriteFailures = cache.getWriteFailures();
        } finally {
            pool.shutdownNow();
            activeRuns.remove(cancelled);
        }

        RunSummary summary = new RunSummary(outcomes, cancelled.get(), cacheWriteFailures,
                Duration.ofNanos(System.nanoTime() - start));
        log.info("Run finished: {}", summary.describe());
        if (cacheWriteFailures > 0) {
            log.warn("{} score cache writes failed; affected scores will be recomputed next run", cacheWriteFailures);
        }
        return summary;
    }

    /**
     * Runs one already normalized image through the pipeline without touching the score cache.
     *
     * @param scoreOverride use this score instead of asking the quality model
     * @throws ScoreUnavailableException if no score can be had and the policy is SKIP
     * @throws BinarizationFailedException if the branch binarizer fails
     */
    public ProcessedImage processImage(BufferedImage image, PreprocessConfig config, OptionalDouble scoreOverride)
            throws PreprocessException {
        OptionalDouble score = scoreOverride;
        if (score.isEmpty()) {
            try {
                score = OptionalDouble.of(assess(image));
            } catch (ScoreUnavailableException e) {
                if (config.getScoreUnavailablePolicy() == PreprocessConfig.ScoreUnavailablePolicy.SKIP) {
                    throw e;
                }
                log.warn("{}; routing to BAD branch", e.getMessage());
            }
        }
        Classification classification = score.isPresent()
                ? QualityGate.classify(score.getAsDouble(), config.getGoodBadThreshold(), config.isLowerIsBetter())
                : Classification.BAD;

        Binarizer binarizer = classification == Classification.GOOD ? mlBinarizer : new SauvolaBinarizer(config);
        BufferedImage enhanced = enhancer.enhance(image, config);
        BufferedImage binary = binarizer.binarize(enhanced);
        DeskewResult deskewed = new Deskewer(config).deskew(binary);
        return new ProcessedImage(deskewed.getImage(), score, classification, deskewed.getAngleDegrees());
    }

    /**
     * Stops scheduling files in every active run. Files already started finish normally;
     * the rest are reported as skipped.
     */
    public void cancel() {
        log.info("Cancelling {} active run(s)", activeRuns.size());
        activeRuns.forEach(flag -> flag.set(true));
    }

    /**
     * Deletes the score cache of {@code sourceRoot} so the next run rescores everything.
     */
    public void resetCache(Path sourceRoot) {
        try (ScoreCache cache = ScoreCache.open(sourceRoot.resolve(cacheFileName))) {
            log.info("Resetting score cache {} ({} entries)", cache.getFile(), cache.size());
            cache.clear();
        }
    }

    @Override
    public void close() {
        modelCalls.close();
    }

    private FileOutcome processFile(PreprocessConfig config, Path sourceRoot, Path input, Path destRoot,
                                    ScoreCache cache, Map<Classification, Binarizer> binarizers,
                                    Deskewer deskewer, UploadNormalizer normalizer) {
        String name = input.getFileName().toString();
        Path output = ImageFiles.outputPath(sourceRoot, input, destRoot, outputFormat);
        FileStage stage = FileStage.SELECTED;
        Classification classification = null;
        Double score = null;
        try {
            BufferedImage image = normalizer.normalize(input);

            if (!config.isSelected(name)) {
                stage = FileStage.PASSTHROUGH;
                write(image, output);
                log.info("{} -> {} (passthrough)", name, output);
                return FileOutcome.passthrough(input, output);
            }

            String key = cacheKey(input);
            OptionalDouble cached = cache.get(key);
            boolean fromCache = cached.isPresent();
            if (fromCache) {
                score = cached.getAsDouble();
            } else {
                try {
                    score = assess(image);
                    cache.put(key, score);
                } catch (ScoreUnavailableException e) {
                    if (config.getScoreUnavailablePolicy() == PreprocessConfig.ScoreUnavailablePolicy.SKIP) {
                        log.warn("Skipping {}: {}", name, e.getMessage());
                        return FileOutcome.skipped(input, stage, e.getMessage());
                    }
                    log.warn("{}: {}; routing to BAD branch", name, e.getMessage());
                }
            }
            if (score != null) {
                stage = FileStage.SCORED;
                classification = QualityGate.classify(score, config.getGoodBadThreshold(), config.isLowerIsBetter());
            } else {
                classification = Classification.BAD;
            }
            stage = FileStage.CLASSIFIED;

            BufferedImage enhanced = enhancer.enhance(image, config);
            stage = FileStage.ENHANCED;
            BufferedImage binary = binarizers.get(classification).binarize(enhanced);
            stage = FileStage.BINARIZED;
            DeskewResult deskewed = deskewer.deskew(binary);
            stage = FileStage.DESKEWED;
            write(deskewed.getImage(), output);

            log.info("{} -> {} (score {}{}, {}, deskew {}°)", name, output, score,
                    fromCache ? " cached" : "", classification, deskewed.getAngleDegrees());
            return FileOutcome.processed(input, output, classification, score, fromCache, deskewed.getAngleDegrees());
        } catch (BinarizationFailedException e) {
            log.error("Binarization failed for {} ({} branch): {}", name, classification, e.getMessage());
            return FileOutcome.failed(input, stage, classification, score, e.getMessage());
        } catch (IOException e) {
            log.error("I/O error on {} after {}: {}", name, stage, e.getMessage());
            return FileOutcome.failed(input, stage, classification, score, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error on {} after {}", name, stage, e);
            return FileOutcome.failed(input, stage, classification, score, String.valueOf(e));
        }
    }

    /**
     * Inputs whose output path is already taken by an earlier input, e.g. {@code p1.png} and
     * {@code p1.jpg} in one folder, mapped to the reason they are not processed.
     */
    private Map<Path, String> outputCollisions(Path sourceRoot, List<Path> inputs, Path destRoot) {
        Map<Path, Path> owners = new HashMap<>();
        Map<Path, String> collisions = new HashMap<>();
        for (Path input : inputs) {
            Path output = ImageFiles.outputPath(sourceRoot, input, destRoot, outputFormat).toAbsolutePath().normalize();
            Path owner = owners.putIfAbsent(output, input);
            if (owner != null) {
                String reason = "Output " + output + " is already written for " + owner;
                log.error("{}: {}", input, reason);
                collisions.put(input, reason);
            }
        }
        return collisions;
    }

    private double assess(BufferedImage image) throws ScoreUnavailableException {
        double score;
        try {
            score = modelCalls.call(() -> qualityModel.assess(image));
        } catch (TimeoutException e) {
            throw new ScoreUnavailableException("Quality model timed out after "
                    + modelCalls.getTimeout().toSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ScoreUnavailableException) {
                throw (ScoreUnavailableException) cause;
            }
            throw new ScoreUnavailableException("Quality model failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScoreUnavailableException("Interrupted while waiting for quality model", e);
        }
        if (!Double.isFinite(score)) {
            throw new ScoreUnavailableException("Quality model returned " + score);
        }
        return score;
    }

    private void write(BufferedImage image, Path output) throws IOException {
        Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, outputFormat, output.toFile())) {
            throw new IOException("No " + outputFormat + " writer for " + output);
        }
    }

    static String cacheKey(Path input) {
        return input.toAbsolutePath().normalize().toString();
    }

    private static void checkDirectories(Path sourceRoot, Path destRoot) {
        if (!Files.isDirectory(sourceRoot) || !Files.isReadable(sourceRoot)) {
            throw new ConfigException("Source directory " + sourceRoot + " does not exist or is not readable");
        }
        Path source = sourceRoot.toAbsolutePath().normalize();
        Path dest = destRoot.toAbsolutePath().normalize();
        if (source.equals(dest)) {
            throw new ConfigException("Destination must differ from the source directory " + sourceRoot);
        }
        try {
            Files.createDirectories(dest);
        } catch (IOException e) {
            throw new ConfigException("Cannot create destination directory " + destRoot + ": " + e.getMessage(), e);
        }
    }
}
