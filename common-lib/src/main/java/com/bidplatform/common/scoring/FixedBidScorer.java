package com.bidplatform.common.scoring;

import com.bidplatform.common.model.Bid;

/**
 * Returns the same score for every bid.
 */
public final class FixedBidScorer implements BidScorer {

    private final double value;

    public FixedBidScorer(double value) {
        this.value = Scores.clamp(value);
    }

    @Override
    public double score(Bid bid) {
        return value;
    }
}
