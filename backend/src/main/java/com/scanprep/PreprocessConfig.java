package com.scanprep;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable per-run preprocessing parameters. Built once through {@link Builder},
 * which rejects invalid values with {@link ConfigException} before any file is read.
 */
public final class PreprocessConfig {

    public static final double DEFAULT_SAUVOLA_K = 0.24;
    public static final int DEFAULT_SAUVOLA_WINDOW = 11;
    public static final double DEFAULT_GOODBAD_THRESHOLD = 0.335;

    /**
     * What to do with an image whose quality score cannot be obtained.
     */
    public enum ScoreUnavailablePolicy {
        /** Record the file as skipped and continue. */
        SKIP,
        /** Route the file to the BAD (Sauvola) branch. */
        TREAT_AS_BAD
    }

    private final double sauvolaK;
    private final int sauvolaWindow;
    private final boolean contrastEnhance;
    private final String selectionRegex;
    private final Pattern selectionPattern;
    private final double goodBadThreshold;
    private final boolean lowerIsBetter;
    private final ScoreUnavailablePolicy scoreUnavailablePolicy;
    private final double denoiseStrength;
    private final int denoiseTemplateWindow;
    private final int denoiseSearchWindow;
    private final double claheClipLimit;
    private final int claheTileGrid;
    private final double deskewMaxAngle;
    private final double deskewAngleStep;
    private final int maxDimension;

    private PreprocessConfig(Builder b, Pattern compiled) {
        this.sauvolaK = b.sauvolaK;
        this.sauvolaWindow = b.sauvolaWindow;
        this.contrastEnhance = b.contrastEnhance;
        this.selectionRegex = b.selectionRegex;
        this.selectionPattern = compiled;
        this.goodBadThreshold = b.goodBadThreshold;
        this.lowerIsBetter = b.lowerIsBetter;
        this.scoreUnavailablePolicy = b.scoreUnavailablePolicy;
        this.denoiseStrength = b.denoiseStrength;
        this.denoiseTemplateWindow = b.denoiseTemplateWindow;
        this.denoiseSearchWindow = b.denoiseSearchWindow;
        this.claheClipLimit = b.claheClipLimit;
        this.claheTileGrid = b.claheTileGrid;
        this.deskewMaxAngle = b.deskewMaxAngle;
        this.deskewAngleStep = b.deskewAngleStep;
        this.maxDimension = b.maxDimension;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PreprocessConfig defaults() {
        return builder().build();
    }

    /**
     * Builder seeded with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .sauvolaK(sauvolaK)
                .sauvolaWindow(sauvolaWindow)
                .contrastEnhance(contrastEnhance)
                .selectionRegex(selectionRegex)
                .goodBadThreshold(goodBadThreshold)
                .lowerIsBetter(lowerIsBetter)
                .scoreUnavailablePolicy(scoreUnavailablePolicy)
                .denoiseStrength(denoiseStrength)
                .denoiseTemplateWindow(denoiseTemplateWindow)
                .denoiseSearchWindow(denoiseSearchWindow)
                .claheClipLimit(claheClipLimit)
                .claheTileGrid(claheTileGrid)
                .deskewMaxAngle(deskewMaxAngle)
                .deskewAngleStep(deskewAngleStep)
                .maxDimension(maxDimension);
    }

    /**
     * True when the file should go through the full pipeline. Without a
     * selection pattern every file is selected; otherwise the pattern must be
     * found somewhere in the file name.
     */
    public boolean isSelected(String fileName) {
        return selectionPattern == null || selectionPattern.matcher(fileName).find();
    }

    public double getSauvolaK() { return sauvolaK; }
    public int getSauvolaWindow() { return sauvolaWindow; }
    public boolean isContrastEnhance() { return contrastEnhance; }
    public String getSelectionRegex() { return selectionRegex; }
    public double getGoodBadThreshold() { return goodBadThreshold; }
    public boolean isLowerIsBetter() { return lowerIsBetter; }
    public ScoreUnavailablePolicy getScoreUnavailablePolicy() { return scoreUnavailablePolicy; }
    public double getDenoiseStrength() { return denoiseStrength; }
    public int getDenoiseTemplateWindow() { return denoiseTemplateWindow; }
    public int getDenoiseSearchWindow() { return denoiseSearchWindow; }
    public double getClaheClipLimit() { return claheClipLimit; }
    public int getClaheTileGrid() { return claheTileGrid; }
    public double getDeskewMaxAngle() { return deskewMaxAngle; }
    public double getDeskewAngleStep() { return deskewAngleStep; }
    public int getMaxDimension() { return maxDimension; }

    @Override
    public String toString() {
        return String.format("k=%.3f window=%d contrast=%s regex=%s threshold=%.3f lowerBetter=%s na=%s",
                sauvolaK, sauvolaWindow, contrastEnhance, selectionRegex, goodBadThreshold,
                lowerIsBetter, scoreUnavailablePolicy);
    }

    public static final class Builder {
        private double sauvolaK = DEFAULT_SAUVOLA_K;
        private int sauvolaWindow = DEFAULT_SAUVOLA_WINDOW;
        private boolean contrastEnhance = false;
        private String selectionRegex;
        private double goodBadThreshold = DEFAULT_GOODBAD_THRESHOLD;
        private boolean lowerIsBetter = false;
        private ScoreUnavailablePolicy scoreUnavailablePolicy = ScoreUnavailablePolicy.SKIP;
        private double denoiseStrength = 10.0;
        private int denoiseTemplateWindow = 7;
        private int denoiseSearchWindow = 21;
        private double claheClipLimit = 2.0;
        private int claheTileGrid = 8;
        private double deskewMaxAngle = 15.0;
        private double deskewAngleStep = 0.5;
        private int maxDimension = 0;

        private Builder() {}

        public Builder sauvolaK(double v) { this.sauvolaK = v; return this; }
        public Builder sauvolaWindow(int v) { this.sauvolaWindow = v; return this; }
        public Builder contrastEnhance(boolean v) { this.contrastEnhance = v; return this; }
        public Builder selectionRegex(String v) { this.selectionRegex = v; return this; }
        public Builder goodBadThreshold(double v) { this.goodBadThreshold = v; return this; }
        public Builder lowerIsBetter(boolean v) { this.lowerIsBetter = v; return this; }
        public Builder scoreUnavailablePolicy(ScoreUnavailablePolicy v) { this.scoreUnavailablePolicy = v; return this; }
        public Builder denoiseStrength(double v) { this.denoiseStrength = v; return this; }
        public Builder denoiseTemplateWindow(int v) { this.denoiseTemplateWindow = v; return this; }
        public Builder denoiseSearchWindow(int v) { this.denoiseSearchWindow = v; return this; }
        public Builder claheClipLimit(double v) { this.claheClipLimit = v; return this; }
        public Builder claheTileGrid(int v) { this.claheTileGrid = v; return this; }
        public Builder deskewMaxAngle(double v) { this.deskewMaxAngle = v; return this; }
        public Builder deskewAngleStep(double v) { this.deskewAngleStep = v; return this; }
        public Builder maxDimension(int v) { this.maxDimension = v; return this; }

        /**
         * Validates and freezes the configuration.
         *
         * @throws ConfigException if any parameter is out of range
         */
        public PreprocessConfig build() {
            checkWindow("Sauvola window size", sauvolaWindow, 3);
            checkWindow("Denoise template window", denoiseTemplateWindow, 1);
            checkWindow("Denoise search window", denoiseSearchWindow, 1);
            checkFinite("Sauvola k", sauvolaK);
            checkFinite("Good/bad threshold", goodBadThreshold);
            checkFinite("Denoise strength", denoiseStrength);
            if (denoiseStrength <= 0) {
                throw new ConfigException("Denoise strength must be positive, got " + denoiseStrength);
            }
            checkFinite("CLAHE clip limit", claheClipLimit);
            if (claheClipLimit <= 0) {
                throw new ConfigException("CLAHE clip limit must be positive, got " + claheClipLimit);
            }
            if (claheTileGrid < 1) {
                throw new ConfigException("CLAHE tile grid must be at least 1, got " + claheTileGrid);
            }
            checkFinite("Deskew max angle", deskewMaxAngle);
            checkFinite("Deskew angle step", deskewAngleStep);
            if (deskewMaxAngle < 0 || deskewMaxAngle > 45) {
                throw new ConfigException("Deskew max angle must be within [0, 45], got " + deskewMaxAngle);
            }
            if (deskewAngleStep <= 0) {
                throw new ConfigException("Deskew angle step must be positive, got " + deskewAngleStep);
            }
            if (maxDimension < 0) {
                throw new ConfigException("Max dimension must not be negative, got " + maxDimension);
            }
            if (scoreUnavailablePolicy == null) {
                throw new ConfigException("Score-unavailable policy must be set");
            }

            Pattern compiled = null;
            if (selectionRegex != null && !selectionRegex.isEmpty()) {
                try {
                    compiled = Pattern.compile(selectionRegex);
                } catch (PatternSyntaxException e) {
                    throw new ConfigException("Invalid selection pattern '" + selectionRegex + "': "
                            + e.getDescription(), e);
                }
            } else {
                selectionRegex = null;
            }
            return new PreprocessConfig(this, compiled);
        }

        private static void checkWindow(String name, int size, int min) {
            if (size < min) {
                throw new ConfigException(name + " must be at least " + min + ", got " + size);
            }
            if (size % 2 == 0) {
                throw new ConfigException(name + " must be odd, got " + size);
            }
        }

        private static void checkFinite(String name, double value) {
            if (!Double.isFinite(value)) {
                throw new ConfigException(name + " must be a finite number, got " + value);
            }
        }
    }
}
