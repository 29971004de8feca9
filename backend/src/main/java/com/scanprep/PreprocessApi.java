package com.scanprep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@RestController
@RequestMapping("/api")
@CrossOrigin(
        origins = "*",
        allowedHeaders = "*",
        exposedHeaders = {"X-Quality-Score", "X-Classification", "X-Deskew-Angle"},
        methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.DELETE, RequestMethod.OPTIONS}
)
public class PreprocessApi {

    private static final Logger log = LoggerFactory.getLogger(PreprocessApi.class);

    private final PreprocessPipeline pipeline;
    private final PreprocessProperties properties;
    private final Map<String, Double> progressStore = new ConcurrentHashMap<>();
    private final Map<String, String> messageStore = new ConcurrentHashMap<>();
    private final Map<String, RunSummary> summaryStore = new ConcurrentHashMap<>();
    private final Map<String, String> errorStore = new ConcurrentHashMap<>();

    public PreprocessApi(PreprocessPipeline pipeline, PreprocessProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    /**
     * Batch run request. Unset fields fall back to the {@code scanprep.*} properties.
     */
    public static class RunRequest {
        public String sourceDir;
        public String destDir;
        public Double k;
        public Integer window;
        public Boolean contrastEnhance;
        public String regex;
        public Double threshold;
        public Boolean lowerIsBetter;
        public Boolean naAsBad;
        public boolean resetCache;
    }

    @GetMapping("/health")
    public ResponseEntity<?> healthCheck() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "message", "scanprep API is running",
                "version", "1.0.0"
        ));
    }

    /**
     * Preprocesses one uploaded image and returns it as PNG. A {@code score} parameter
     * bypasses the quality model.
     */
    @PostMapping("/preprocess/image")
    public ResponseEntity<?> preprocessImage(@RequestParam("image") MultipartFile imageFile,
                                             @RequestParam(value = "k", required = false) Double k,
                                             @RequestParam(value = "window", required = false) Integer window,
                                             @RequestParam(value = "contrastEnhance", required = false) Boolean contrastEnhance,
                                             @RequestParam(value = "threshold", required = false) Double threshold,
                                             @RequestParam(value = "score", required = false) Double score) {
        PreprocessConfig config;
        try {
            PreprocessConfig.Builder builder = properties.toConfigBuilder();
            if (k != null) builder.sauvolaK(k);
            if (window != null) builder.sauvolaWindow(window);
            if (contrastEnhance != null) builder.contrastEnhance(contrastEnhance);
            if (threshold != null) builder.goodBadThreshold(threshold);
            config = builder.build();
        } catch (ConfigException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        if (score != null && !Double.isFinite(score)) {
            return error(HttpStatus.BAD_REQUEST, "score must be a finite number");
        }

        String name = imageFile.getOriginalFilename() != null ? imageFile.getOriginalFilename() : "upload";
        BufferedImage image;
        try {
            image = new UploadNormalizer(config.getMaxDimension()).normalize(imageFile.getBytes(), name);
        } catch (IOException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        try {
            ProcessedImage result = pipeline.processImage(image, config,
                    score != null ? OptionalDouble.of(score) : OptionalDouble.empty());
            ByteArrayOutputStream png = new ByteArrayOutputStream();
            ImageIO.write(result.getImage(), "png", png);

            log.info("Preprocessed upload {} ({}, deskew {}°)", name, result.getClassification(),
                    result.getDeskewAngle());
            ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .header("X-Classification", result.getClassification().name())
                    .header("X-Deskew-Angle", String.valueOf(result.getDeskewAngle()));
            if (result.getScore().isPresent()) {
                response.header("X-Quality-Score", String.valueOf(result.getScore().getAsDouble()));
            }
            return response.body(png.toByteArray());
        } catch (ScoreUnavailableException e) {
            return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
        } catch (PreprocessException | IOException e) {
            log.error("Preprocessing upload {} failed: {}", name, e.getMessage());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * Starts a batch run in the background and returns its id for progress polling.
     */
    @PostMapping("/preprocess/runs")
    public ResponseEntity<?> startRun(@RequestBody RunRequest request) {
        if (request.sourceDir == null || request.destDir == null) {
            return error(HttpStatus.BAD_REQUEST, "sourceDir and destDir are required");
        }
        Path source = Paths.get(request.sourceDir);
        Path dest = Paths.get(request.destDir);
        if (!Files.isDirectory(source)) {
            return error(HttpStatus.BAD_REQUEST, "Source directory " + source + " does not exist");
        }

        PreprocessConfig config;
        try {
            PreprocessConfig.Builder builder = properties.toConfigBuilder();
            if (request.k != null) builder.sauvolaK(request.k);
            if (request.window != null) builder.sauvolaWindow(request.window);
            if (request.contrastEnhance != null) builder.contrastEnhance(request.contrastEnhance);
            if (request.regex != null) builder.selectionRegex(request.regex);
            if (request.threshold != null) builder.goodBadThreshold(request.threshold);
            if (request.lowerIsBetter != null) builder.lowerIsBetter(request.lowerIsBetter);
            if (request.naAsBad != null) {
                builder.scoreUnavailablePolicy(request.naAsBad
                        ? PreprocessConfig.ScoreUnavailablePolicy.TREAT_AS_BAD
                        : PreprocessConfig.ScoreUnavailablePolicy.SKIP);
            }
            config = builder.build();
        } catch (ConfigException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        String runId = UUID.randomUUID().toString();
        updateProgress(runId, 0.0, "Queued");

        new Thread(() -> {
            try {
                if (request.resetCache) {
                    pipeline.resetCache(source);
                }
                RunSummary summary = pipeline.run(config, source, dest,
                        (outcome, completed, total) -> updateProgress(runId, (double) completed / total,
                                "Processed " + completed + " of " + total));
                // Summary last: its presence marks the run done
                updateProgress(runId, 1.0, summary.describe());
                summaryStore.put(runId, summary);
            } catch (ConfigException e) {
                log.error("Run {} rejected: {}", runId, e.getMessage());
                updateProgress(runId, 0.0, "Error: " + e.getMessage());
                errorStore.put(runId, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Run {} failed", runId, e);
                updateProgress(runId, 0.0, "Error: " + e.getMessage());
                errorStore.put(runId, String.valueOf(e.getMessage()));
            }
        }, "run-" + runId).start();

        return ResponseEntity.ok(Map.of("runId", runId));
    }

    /**
     * Progress of a run. Once the finished state has been returned the run is forgotten.
     */
    @GetMapping("/preprocess/runs/{runId}")
    public ResponseEntity<?> getRun(@PathVariable String runId) {
        Double progress = progressStore.get(runId);
        if (progress == null) {
            return ResponseEntity.notFound().build();
        }
        RunSummary summary = summaryStore.get(runId);
        String error = errorStore.get(runId);

        boolean done = summary != null || error != null;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", runId);
        body.put("progress", progress);
        body.put("message", messageStore.getOrDefault(runId, "Processing..."));
        body.put("done", done);
        if (summary != null) {
            body.put("summary", summary.toMap());
        }
        if (error != null) {
            body.put("error", error);
        }
        if (done) {
            // Clean up, a finished run is reported once
            progressStore.remove(runId);
            messageStore.remove(runId);
            summaryStore.remove(runId);
            errorStore.remove(runId);
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Stops scheduling files in all active runs.
     */
    @DeleteMapping("/preprocess/runs")
    public ResponseEntity<?> cancelRuns() {
        pipeline.cancel();
        return ResponseEntity.ok(Map.of("cancelled", true));
    }

    private void updateProgress(String runId, double progress, String message) {
        progressStore.put(runId, progress);
        messageStore.put(runId, message);
        log.debug("Run {}: {}% {}", runId, Math.round(progress * 100), message);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
