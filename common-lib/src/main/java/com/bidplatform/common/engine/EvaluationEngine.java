package com.bidplatform.common.engine;

import com.bidplatform.common.model.EvaluationRequest;
import com.bidplatform.common.model.EvaluationResult;

/**
 * Contract for scoring, ranking and classifying the bids of one RFQ.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>:      no logging, no reactive types, no I/O</li>
 *   <li><b>All-or-nothing</b>: input errors are thrown before any bid is scored</li>
 * </ul>
 *
 * <p>Current implementation: {@link WeightedBidEvaluationEngine}.
 */
public interface EvaluationEngine {

    /**
     * @param rfqId       the RFQ the bids belong to
     * @param evaluatorId identity of whoever triggered the run; echoed, never checked
     * @param request     criteria, bids and optional evaluator notes
     * @return the ranked result, never {@code null}
     * @throws com.bidplatform.common.exception.InvalidCriteriaException if the weights are invalid
     * @throws com.bidplatform.common.exception.EmptyBidSetException     if no bids were supplied
     * @throws com.bidplatform.common.exception.MalformedBidException    if any bid is malformed
     */
    EvaluationResult evaluate(String rfqId, String evaluatorId, EvaluationRequest request);
}
