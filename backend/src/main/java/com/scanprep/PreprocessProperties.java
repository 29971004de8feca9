package com.scanprep;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code scanprep.*}. The processing fields are defaults for
 * {@link PreprocessConfig}; command-line options and REST parameters override them per run.
 */
@ConfigurationProperties(prefix = "scanprep")
public class PreprocessProperties {

    public enum ModelMode {
        /** No model: every request fails and the file follows the score-unavailable policy. */
        NONE,
        COMMAND,
        HTTP
    }

    private double sauvolaK = PreprocessConfig.DEFAULT_SAUVOLA_K;
    private int sauvolaWindow = PreprocessConfig.DEFAULT_SAUVOLA_WINDOW;
    private boolean contrastEnhance = false;
    private String selectionRegex;
    private double goodbadThreshold = PreprocessConfig.DEFAULT_GOODBAD_THRESHOLD;
    private boolean lowerIsBetter = false;

    /** Route images without a usable score to the BAD branch instead of skipping them. */
    private boolean naAsBad = false;

    private double denoiseStrength = 10.0;
    private int denoiseTemplateWindow = 7;
    private int denoiseSearchWindow = 21;
    private double claheClipLimit = 2.0;
    private int claheTileGrid = 8;
    private double deskewMaxAngle = 15.0;
    private double deskewAngleStep = 0.5;

    /** Longest side after normalization in pixels, 0 keeps the original size. */
    private int maxDimension = 0;

    /** Parallel file workers, 0 for one per processor. */
    private int workerThreads = 0;

    /** Upper bound for a single call to either model. */
    private Duration modelTimeout = Duration.ofSeconds(120);

    private String cacheFileName = "image_scores.json";
    private String outputFormat = "png";

    /** Optional path of the JSON run report written after batch runs. */
    private String reportFile;

    private final Quality quality = new Quality();
    private final Binarizer binarizer = new Binarizer();

    public static class Quality {
        private ModelMode mode = ModelMode.NONE;

        /** Command template containing {input}; the score is the last number printed. */
        private String command;

        /** Endpoint receiving PNG bytes and answering {"score": n}. */
        private String url;

        public ModelMode getMode() { return mode; }
        public void setMode(ModelMode mode) { this.mode = mode; }
        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }

    public static class Binarizer {
        /** Command template containing {input} and {output}; blank disables the GOOD branch. */
        private String command;

        public String getCommand() { return command; }
        public void setCommand(String command) { this.command = command; }
    }

    /**
     * Run configuration builder seeded from these properties; {@code build()} validates them.
     */
    public PreprocessConfig.Builder toConfigBuilder() {
        return PreprocessConfig.builder()
                .sauvolaK(sauvolaK)
                .sauvolaWindow(sauvolaWindow)
                .contrastEnhance(contrastEnhance)
                .selectionRegex(selectionRegex)
                .goodBadThreshold(goodbadThreshold)
                .lowerIsBetter(lowerIsBetter)
                .scoreUnavailablePolicy(naAsBad
                        ? PreprocessConfig.ScoreUnavailablePolicy.TREAT_AS_BAD
                        : PreprocessConfig.ScoreUnavailablePolicy.SKIP)
                .denoiseStrength(denoiseStrength)
                .denoiseTemplateWindow(denoiseTemplateWindow)
                .denoiseSearchWindow(denoiseSearchWindow)
                .claheClipLimit(claheClipLimit)
                .claheTileGrid(claheTileGrid)
                .deskewMaxAngle(deskewMaxAngle)
                .deskewAngleStep(deskewAngleStep)
                .maxDimension(maxDimension);
    }

    public double getSauvolaK() { return sauvolaK; }
    public void setSauvolaK(double sauvolaK) { this.sauvolaK = sauvolaK; }
    public int getSauvolaWindow() { return sauvolaWindow; }
    public void setSauvolaWindow(int sauvolaWindow) { this.sauvolaWindow = sauvolaWindow; }
    public boolean isContrastEnhance() { return contrastEnhance; }
    public void setContrastEnhance(boolean contrastEnhance) { this.contrastEnhance = contrastEnhance; }
    public String getSelectionRegex() { return selectionRegex; }
    public void setSelectionRegex(String selectionRegex) { this.selectionRegex = selectionRegex; }
    public double getGoodbadThreshold() { return goodbadThreshold; }
    public void setGoodbadThreshold(double goodbadThreshold) { this.goodbadThreshold = goodbadThreshold; }
    public boolean isLowerIsBetter() { return lowerIsBetter; }
    public void setLowerIsBetter(boolean lowerIsBetter) { this.lowerIsBetter = lowerIsBetter; }
    public boolean isNaAsBad() { return naAsBad; }
    public void setNaAsBad(boolean naAsBad) { this.naAsBad = naAsBad; }
    public double getDenoiseStrength() { return denoiseStrength; }
    public void setDenoiseStrength(double denoiseStrength) { this.denoiseStrength = denoiseStrength; }
    public int getDenoiseTemplateWindow() { return denoiseTemplateWindow; }
    public void setDenoiseTemplateWindow(int denoiseTemplateWindow) { this.denoiseTemplateWindow = denoiseTemplateWindow; }
    public int getDenoiseSearchWindow() { return denoiseSearchWindow; }
    public void setDenoiseSearchWindow(int denoiseSearchWindow) { this.denoiseSearchWindow = denoiseSearchWindow; }
    public double getClaheClipLimit() { return claheClipLimit; }
    public void setClaheClipLimit(double claheClipLimit) { this.claheClipLimit = claheClipLimit; }
    public int getClaheTileGrid() { return claheTileGrid; }
    public void setClaheTileGrid(int claheTileGrid) { this.claheTileGrid = claheTileGrid; }
    public double getDeskewMaxAngle() { return deskewMaxAngle; }
    public void setDeskewMaxAngle(double deskewMaxAngle) { this.deskewMaxAngle = deskewMaxAngle; }
    public double getDeskewAngleStep() { return deskewAngleStep; }
    public void setDeskewAngleStep(double deskewAngleStep) { this.deskewAngleStep = deskewAngleStep; }
    public int getMaxDimension() { return maxDimension; }
    public void setMaxDimension(int maxDimension) { this.maxDimension = maxDimension; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public Duration getModelTimeout() { return modelTimeout; }
    public void setModelTimeout(Duration modelTimeout) { this.modelTimeout = modelTimeout; }
    public String getCacheFileName() { return cacheFileName; }
    public void setCacheFileName(String cacheFileName) { this.cacheFileName = cacheFileName; }
    public String getOutputFormat() { return outputFormat; }
    public void setOutputFormat(String outputFormat) { this.outputFormat = outputFormat; }
    public String getReportFile() { return reportFile; }
    public void setReportFile(String reportFile) { this.reportFile = reportFile; }
    public Quality getQuality() { return quality; }
    public Binarizer getBinarizer() { return binarizer; }
}
