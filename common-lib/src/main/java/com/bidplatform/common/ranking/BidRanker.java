package com.bidplatform.common.ranking;

import com.bidplatform.common.model.BidEvaluation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders scored bids by total score, highest first, and assigns 1-based rankings
 * and recommendation tiers.
 *
 * <p>The sort is stable: bids with equal totals keep their input order, so the same
 * request always produces the same ranking.
 */
public final class BidRanker {

    private static final Comparator<BidEvaluation> BY_TOTAL_DESC =
        Comparator.comparingDouble(BidEvaluation::totalScore).reversed();

    private final RecommendationClassifier classifier;

    public BidRanker(RecommendationClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * @param scored unranked evaluations in input order
     * @return new list ordered by ranking ascending
     */
    public List<BidEvaluation> rank(List<BidEvaluation> scored) {
        // List.sort is a stable merge sort
        List<BidEvaluation> sorted = new ArrayList<>(scored);
        sorted.sort(BY_TOTAL_DESC);

        List<BidEvaluation> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            BidEvaluation e = sorted.get(i);
            ranked.add(e.ranked(i + 1, classifier.classify(e.totalScore())));
        }
        return List.copyOf(ranked);
    }
}
