package com.bidplatform.common.scoring;

import com.bidplatform.common.model.EvaluationCriteria;

/**
 * Weighted average of the five sub-scores.
 *
 * <pre>
 *   total = (price × w_price + delivery × w_delivery + quality × w_quality
 *            + experience × w_experience + sustainability × w_sustainability) / 100
 * </pre>
 *
 * Weights are validated to sum to 100 beforehand, so this is a true weighted average.
 * The result is clamped to [0, 100] and rounded to two decimals.
 */
public final class CompositeScorer {

    private static final double WEIGHT_TOTAL = 100.0;

    private CompositeScorer() {}

    public static double combine(EvaluationCriteria criteria,
                                 double price, double delivery, double quality,
                                 double experience, double sustainability) {
        double weighted = price          * criteria.priceWeight()
                        + delivery       * criteria.deliveryWeight()
                        + quality        * criteria.qualityWeight()
                        + experience     * criteria.experienceWeight()
                        + sustainability * criteria.sustainabilityWeight();
        return Scores.round2(Scores.clamp(weighted / WEIGHT_TOTAL));
    }
}
