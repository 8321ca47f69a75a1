package com.bidplatform.common.ranking;

import com.bidplatform.common.model.Recommendation;
import com.bidplatform.common.policy.ScoringPolicy;

/**
 * Maps a rounded total score to a recommendation tier.
 *
 * <pre>
 *   score ≥ 85        → AWARD
 *   70 ≤ score &lt; 85 → SHORTLIST
 *   score &lt; 70      → REJECT
 * </pre>
 *
 * Thresholds come from {@link ScoringPolicy}; the values above are the defaults.
 */
public final class RecommendationClassifier {

    private final double awardThreshold;
    private final double shortlistThreshold;

    public RecommendationClassifier(ScoringPolicy policy) {
        this.awardThreshold = policy.awardThreshold();
        this.shortlistThreshold = policy.shortlistThreshold();
    }

    public Recommendation classify(double totalScore) {
        if (totalScore >= awardThreshold)     return Recommendation.AWARD;
        if (totalScore >= shortlistThreshold) return Recommendation.SHORTLIST;
        return Recommendation.REJECT;
    }
}
