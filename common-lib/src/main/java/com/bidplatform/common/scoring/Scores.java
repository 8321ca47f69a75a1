package com.bidplatform.common.scoring;

/**
 * Shared rounding and clamping for 0–100 scores.
 */
public final class Scores {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private Scores() {}

    /** Clamp to [0, 100]; NaN becomes 0. */
    public static double clamp(double score) {
        if (Double.isNaN(score)) return MIN;
        return Math.max(MIN, Math.min(MAX, score));
    }

    /** Round half-up to two decimals. */
    public static double round2(double score) {
        return Math.round(score * 100.0) / 100.0;
    }
}
