package com.scanprep;

/**
 * Maps a quality score onto {@link Classification}. The boundary is closed on the GOOD side.
 */
public final class QualityGate {

    private QualityGate() {}

    public static Classification classify(double score, double threshold) {
        return score >= threshold ? Classification.GOOD : Classification.BAD;
    }

    /**
     * Same as {@link #classify(double, double)} for metrics where a lower score means a better image.
     */
    public static Classification classify(double score, double threshold, boolean lowerIsBetter) {
        if (lowerIsBetter) {
            return score <= threshold ? Classification.GOOD : Classification.BAD;
        }
        return classify(score, threshold);
    }
}
