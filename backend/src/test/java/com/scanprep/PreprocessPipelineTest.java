package com.scanprep;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PreprocessPipelineTest {

    @TempDir
    Path dir;

    private Path source;
    private Path dest;
    private final AtomicInteger qualityCalls = new AtomicInteger();
    private final AtomicInteger binarizerCalls = new AtomicInteger();
    private final List<PreprocessPipeline> pipelines = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        source = Files.createDirectories(dir.resolve("scans"));
        dest = dir.resolve("out");
    }

    @AfterEach
    void tearDown() {
        pipelines.forEach(PreprocessPipeline::close);
    }

    // --- Stub models ---

    private QualityModel fixedScore(double score) {
        return image -> {
            qualityCalls.incrementAndGet();
            return score;
        };
    }

    /** Score chosen by image width, so each test file can get its own score. */
    private QualityModel scoreByWidth(Map<Integer, Double> scores) {
        return image -> {
            qualityCalls.incrementAndGet();
            return scores.get(image.getWidth());
        };
    }

    private BinarizationModel identityModel() {
        return gray -> {
            binarizerCalls.incrementAndGet();
            return gray;
        };
    }

    private PreprocessPipeline pipeline(QualityModel quality, BinarizationModel binarizer, int workers) {
        PreprocessPipeline p = new PreprocessPipeline(quality, binarizer,
                new ModelCallExecutor(Duration.ofSeconds(30)), workers, "image_scores.json", "png");
        pipelines.add(p);
        return p;
    }

    private PreprocessPipeline pipeline(QualityModel quality, BinarizationModel binarizer) {
        return pipeline(quality, binarizer, 2);
    }

    private static BufferedImage read(Path file) throws IOException {
        BufferedImage img = ImageIO.read(file.toFile());
        assertNotNull(img, "unreadable output " + file);
        return img;
    }

    private static FileOutcome outcomeFor(RunSummary summary, String fileName) {
        return summary.getOutcomes().stream()
                .filter(o -> o.getSource().getFileName().toString().equals(fileName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no outcome for " + fileName));
    }

    // --- Scenarios ---

    @Test
    void whitePageTakesGoodBranchAndStaysWhite() throws IOException {
        TestImages.writePng(TestImages.solidRgb(100, 80, Color.WHITE), source.resolve("page.png"));

        RunSummary summary = pipeline(fixedScore(0.5), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        FileOutcome outcome = outcomeFor(summary, "page.png");
        assertEquals(FileOutcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(Classification.GOOD, outcome.getClassification());
        assertEquals(0.5, outcome.getScore());
        assertEquals(FileStage.WRITTEN, outcome.getLastStage());
        assertEquals(1, binarizerCalls.get());

        BufferedImage out = read(dest.resolve("page.png"));
        assertEquals(100, out.getWidth());
        assertEquals(80, out.getHeight());
        assertEquals(100 * 80, TestImages.countSamples(out, 255));
    }

    @Test
    void skewedBarsTakeSauvolaBranchAndAreDeskewed() throws IOException {
        BufferedImage bars = TestImages.toRgb(TestImages.rotatedBars(200, 50, 10.0, 20, 180, 12, 36, 12, 4));
        TestImages.writePng(bars, source.resolve("bars.png"));

        RunSummary summary = pipeline(fixedScore(0.1), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        FileOutcome outcome = outcomeFor(summary, "bars.png");
        assertEquals(FileOutcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(Classification.BAD, outcome.getClassification());
        assertEquals(0, binarizerCalls.get());
        assertEquals(-10.0, outcome.getDeskewAngle(), 1.0);

        BufferedImage out = read(dest.resolve("bars.png"));
        assertTrue(GrayRasters.isBinary(out));
        assertTrue(TestImages.countSamples(out, GrayRasters.FOREGROUND) > 500);
        assertTrue(Math.abs(new Deskewer(15.0, 0.5).estimateAngle(out)) <= 1.0);
    }

    @Test
    void secondRunWithWarmCacheIsIdenticalAndNeverCallsTheModel() throws IOException {
        TestImages.writePng(TestImages.solidRgb(60, 40, Color.WHITE), source.resolve("good.png"));
        TestImages.writePng(TestImages.toRgb(TestImages.textPage(70, 60, 3.0)), source.resolve("bad.png"));
        TestImages.writePng(TestImages.toRgb(TestImages.textPage(80, 60, 0.0)), source.resolve("sub/worse.png"));
        Map<Integer, Double> scores = Map.of(60, 0.9, 70, 0.1, 80, 0.2);

        RunSummary first = pipeline(scoreByWidth(scores), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);
        assertEquals(3, first.getSucceeded());
        assertEquals(3, qualityCalls.get());
        byte[] good = Files.readAllBytes(dest.resolve("good.png"));
        byte[] bad = Files.readAllBytes(dest.resolve("bad.png"));
        byte[] worse = Files.readAllBytes(dest.resolve("sub/worse.png"));

        RunSummary second = pipeline(scoreByWidth(scores), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);
        assertEquals(3, second.getSucceeded());
        assertEquals(3, qualityCalls.get());
        assertTrue(second.getOutcomes().stream().allMatch(FileOutcome::isScoreFromCache));
        assertArrayEquals(good, Files.readAllBytes(dest.resolve("good.png")));
        assertArrayEquals(bad, Files.readAllBytes(dest.resolve("bad.png")));
        assertArrayEquals(worse, Files.readAllBytes(dest.resolve("sub/worse.png")));
    }

    @Test
    void inputsSharingAnOutputPathDoNotOverwriteEachOther() throws IOException {
        TestImages.writePng(TestImages.solidRgb(40, 30, Color.WHITE), source.resolve("p1.png"));
        ImageIO.write(TestImages.solidRgb(50, 30, Color.WHITE), "jpg", source.resolve("p1.jpg").toFile());

        RunSummary summary = pipeline(fixedScore(0.9), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertEquals(2, summary.getTotal());
        assertEquals(1, summary.getSucceeded());
        assertEquals(1, summary.getFailed());
        assertEquals(FileOutcome.Status.SUCCESS, outcomeFor(summary, "p1.jpg").getStatus());
        FileOutcome loser = outcomeFor(summary, "p1.png");
        assertEquals(FileOutcome.Status.FAILED, loser.getStatus());
        assertTrue(loser.getMessage().contains("p1.jpg"), loser.getMessage());
        assertEquals(50, read(dest.resolve("p1.png")).getWidth());
        assertEquals(1, qualityCalls.get());
    }

    @Test
    void scoresAreCachedUnderAbsolutePaths() throws IOException {
        Path page = TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));

        pipeline(fixedScore(0.42), identityModel()).run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        try (ScoreCache cache = ScoreCache.open(source.resolve("image_scores.json"))) {
            assertEquals(0.42, cache.get(PreprocessPipeline.cacheKey(page)).getAsDouble());
        }
    }

    @Test
    void unselectedFilesAreOnlyNormalized() throws IOException {
        TestImages.writePng(TestImages.solidRgb(40, 30, Color.WHITE), source.resolve("page_1.png"));
        BufferedImage cover = TestImages.solidRgb(50, 30, new Color(200, 30, 30));
        TestImages.writePng(cover, source.resolve("cover.png"));

        PreprocessConfig config = PreprocessConfig.builder().selectionRegex("^page").build();
        RunSummary summary = pipeline(fixedScore(0.9), identityModel())
                .run(config, source, dest, ProgressListener.NONE);

        assertEquals(1, qualityCalls.get());
        assertEquals(1, summary.getPassthrough());
        assertEquals(1, summary.getGood());
        FileOutcome passthrough = outcomeFor(summary, "cover.png");
        assertTrue(passthrough.isPassthrough());
        assertEquals(FileStage.WRITTEN, passthrough.getLastStage());

        BufferedImage out = read(dest.resolve("cover.png"));
        assertEquals(cover.getRGB(10, 10), out.getRGB(10, 10));
    }

    @Test
    void missingScoreSkipsFileAndCachesNothing() throws IOException {
        TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));

        RunSummary summary = pipeline(QualityModel.none(), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertEquals(1, summary.getSkipped());
        assertEquals(0, summary.getFailed());
        assertFalse(Files.exists(dest.resolve("page.png")));
        try (ScoreCache cache = ScoreCache.open(source.resolve("image_scores.json"))) {
            assertEquals(0, cache.size());
        }
    }

    @Test
    void nonFiniteScoreIsTreatedAsMissing() throws IOException {
        TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));

        RunSummary summary = pipeline(fixedScore(Double.NaN), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertEquals(FileOutcome.Status.SKIPPED, outcomeFor(summary, "page.png").getStatus());
        try (ScoreCache cache = ScoreCache.open(source.resolve("image_scores.json"))) {
            assertEquals(0, cache.size());
        }
    }

    @Test
    void missingScoreCanRouteToSauvola() throws IOException {
        TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));

        PreprocessConfig config = PreprocessConfig.builder()
                .scoreUnavailablePolicy(PreprocessConfig.ScoreUnavailablePolicy.TREAT_AS_BAD)
                .build();
        RunSummary summary = pipeline(QualityModel.none(), identityModel())
                .run(config, source, dest, ProgressListener.NONE);

        FileOutcome outcome = outcomeFor(summary, "page.png");
        assertEquals(FileOutcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(Classification.BAD, outcome.getClassification());
        assertNull(outcome.getScore());
        assertTrue(Files.exists(dest.resolve("page.png")));
    }

    @Test
    void binarizationFailureOnlyFailsItsFile() throws IOException {
        TestImages.writePng(TestImages.solidRgb(60, 40, Color.WHITE), source.resolve("good.png"));
        TestImages.writePng(TestImages.solidRgb(70, 40, Color.WHITE), source.resolve("bad.png"));

        RunSummary summary = pipeline(scoreByWidth(Map.of(60, 0.9, 70, 0.1)), gray -> {
            throw new IOException("model crashed");
        }).run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        FileOutcome failed = outcomeFor(summary, "good.png");
        assertEquals(FileOutcome.Status.FAILED, failed.getStatus());
        assertEquals(FileStage.ENHANCED, failed.getLastStage());
        assertEquals(Classification.GOOD, failed.getClassification());
        assertEquals(FileOutcome.Status.SUCCESS, outcomeFor(summary, "bad.png").getStatus());
        assertTrue(summary.hasFailures());
        assertFalse(Files.exists(dest.resolve("good.png")));
        assertTrue(Files.exists(dest.resolve("bad.png")));
    }

    @Test
    void unreadableImageFailsAndRunContinues() throws IOException {
        Files.writeString(source.resolve("broken.png"), "not an image", StandardCharsets.UTF_8);
        TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));

        RunSummary summary = pipeline(fixedScore(0.9), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        FileOutcome broken = outcomeFor(summary, "broken.png");
        assertEquals(FileOutcome.Status.FAILED, broken.getStatus());
        assertEquals(FileStage.SELECTED, broken.getLastStage());
        assertEquals(1, summary.getSucceeded());
    }

    @Test
    void relativeDirectoriesAreMirrored() throws IOException {
        BufferedImage scan = TestImages.solidRgb(30, 20, Color.WHITE);
        Files.createDirectories(source.resolve("box1/folder2"));
        ImageIO.write(scan, "jpg", source.resolve("box1/folder2/scan.jpg").toFile());

        pipeline(fixedScore(0.9), identityModel()).run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertTrue(Files.exists(dest.resolve("box1/folder2/scan.png")));
    }

    @Test
    void cancelSkipsFilesNotYetStarted() throws IOException {
        for (int i = 0; i < 3; i++) {
            TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page" + i + ".png"));
        }
        AtomicReference<PreprocessPipeline> self = new AtomicReference<>();
        PreprocessPipeline p = pipeline(image -> {
            qualityCalls.incrementAndGet();
            self.get().cancel();
            return 0.9;
        }, identityModel(), 1);
        self.set(p);

        RunSummary summary = p.run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertTrue(summary.isCancelled());
        assertEquals(1, qualityCalls.get());
        assertEquals(1, summary.getSucceeded());
        assertEquals(2, summary.getSkipped());
    }

    @Test
    void progressIsReportedForEveryFile() throws IOException {
        for (int i = 0; i < 3; i++) {
            TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page" + i + ".png"));
        }
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger lastTotal = new AtomicInteger();
        pipeline(fixedScore(0.9), identityModel()).run(PreprocessConfig.defaults(), source, dest,
                (outcome, completed, total) -> {
                    calls.incrementAndGet();
                    lastTotal.set(total);
                });
        assertEquals(3, calls.get());
        assertEquals(3, lastTotal.get());
    }

    @Test
    void reportCountsEveryOutcome() throws IOException {
        TestImages.writePng(TestImages.solidRgb(60, 40, Color.WHITE), source.resolve("good.png"));
        TestImages.writePng(TestImages.solidRgb(70, 40, Color.WHITE), source.resolve("bad.png"));

        RunSummary summary = pipeline(scoreByWidth(Map.of(60, 0.9, 70, 0.1)), identityModel())
                .run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);
        Path report = dir.resolve("reports/run.json");
        summary.writeReport(report);

        JsonObject json = JsonParser.parseString(Files.readString(report, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals(2, json.get("total").getAsInt());
        assertEquals(2, json.get("succeeded").getAsInt());
        assertEquals(1, json.get("good").getAsInt());
        assertEquals(1, json.get("bad").getAsInt());
        assertEquals(2, json.getAsJsonArray("files").size());
    }

    @Test
    void unusableDirectoriesRejectedBeforeProcessing() {
        PreprocessPipeline p = pipeline(fixedScore(0.9), identityModel());
        assertThrows(ConfigException.class,
                () -> p.run(PreprocessConfig.defaults(), dir.resolve("missing"), dest, ProgressListener.NONE));
        assertThrows(ConfigException.class,
                () -> p.run(PreprocessConfig.defaults(), source, source, ProgressListener.NONE));
        assertEquals(0, qualityCalls.get());
    }

    @Test
    void resetCacheForcesRescoring() throws IOException {
        TestImages.writePng(TestImages.solidRgb(30, 20, Color.WHITE), source.resolve("page.png"));
        PreprocessPipeline p = pipeline(fixedScore(0.9), identityModel());

        p.run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);
        p.resetCache(source);
        p.run(PreprocessConfig.defaults(), source, dest, ProgressListener.NONE);

        assertEquals(2, qualityCalls.get());
    }

    @Test
    void singleImageUsesScoreOverride() throws PreprocessException {
        PreprocessPipeline p = pipeline(QualityModel.none(), identityModel());
        ProcessedImage result = p.processImage(TestImages.solidRgb(30, 20, Color.WHITE),
                PreprocessConfig.defaults(), OptionalDouble.of(0.9));

        assertEquals(Classification.GOOD, result.getClassification());
        assertEquals(0.9, result.getScore().getAsDouble());
        assertEquals(0.0, result.getDeskewAngle());
        assertEquals(30 * 20, TestImages.countSamples(result.getImage(), 255));
    }

    @Test
    void singleImageWithoutScoreFollowsPolicy() throws PreprocessException {
        PreprocessPipeline p = pipeline(QualityModel.none(), identityModel());
        BufferedImage page = TestImages.solidRgb(30, 20, Color.WHITE);

        assertThrows(ScoreUnavailableException.class,
                () -> p.processImage(page, PreprocessConfig.defaults(), OptionalDouble.empty()));

        PreprocessConfig naAsBad = PreprocessConfig.builder()
                .scoreUnavailablePolicy(PreprocessConfig.ScoreUnavailablePolicy.TREAT_AS_BAD)
                .build();
        ProcessedImage result = p.processImage(page, naAsBad, OptionalDouble.empty());
        assertEquals(Classification.BAD, result.getClassification());
        assertFalse(result.getScore().isPresent());
    }
}
