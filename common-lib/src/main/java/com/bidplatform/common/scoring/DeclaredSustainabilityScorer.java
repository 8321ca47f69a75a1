package com.bidplatform.common.scoring;

import com.bidplatform.common.model.Bid;

/**
 * Uses the bid's own {@code sustainability_score} when declared (zero included),
 * otherwise defers to {@code fallback}.
 */
public final class DeclaredSustainabilityScorer implements BidScorer {

    private final BidScorer fallback;

    public DeclaredSustainabilityScorer(BidScorer fallback) {
        this.fallback = fallback;
    }

    @Override
    public double score(Bid bid) {
        Double declared = bid.sustainabilityScore();
        return declared != null ? declared : fallback.score(bid);
    }
}
