package com.bidplatform.common.normalize;

/**
 * Min-max scaling of one raw attribute across the current bid set into [0, 100],
 * where the lowest raw value is best.
 *
 * <pre>
 *   max == min → 100 for every entry
 *   otherwise  → (max − value) / (max − min) × 100
 * </pre>
 *
 * Results are unrounded; rounding happens once, when the evaluation row is built.
 */
public final class MinMaxNormalizer {

    static final double MAX_SCORE = 100.0;

    private MinMaxNormalizer() {}

    /**
     * @param values raw attribute values, one per bid; must not be empty
     * @return scores aligned with {@code values}
     */
    public static double[] lowerIsBetter(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("cannot normalize an empty value set");
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        double[] scores = new double[values.length];
        double range = max - min;
        for (int i = 0; i < values.length; i++) {
            scores[i] = range == 0.0 ? MAX_SCORE : (max - values[i]) / range * MAX_SCORE;
        }
        return scores;
    }
}
