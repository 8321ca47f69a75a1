package com.bidplatform.common.scoring;

import com.bidplatform.common.model.Bid;

/**
 * Strategy contract for a per-bid sub-score that does not depend on the rest of the bid set
 * (experience, sustainability).
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Deterministic</b>: the same bid always yields the same score</li>
 *   <li><b>Stateless</b>:     safe to share across concurrent evaluations</li>
 *   <li><b>Bounded</b>:       return a value in [0, 100]; the engine clamps anything else</li>
 * </ul>
 *
 * <p>Pass a different implementation to the
 * {@link com.bidplatform.common.engine.WeightedBidEvaluationEngine} constructor to plug in
 * real supplier data.
 */
@FunctionalInterface
public interface BidScorer {

    double score(Bid bid);
}
