package com.bidplatform.common.exception;

/**
 * Thrown when an evaluation request carries no bids.
 */
public class EmptyBidSetException extends EvaluationException {

    public static final String CODE = "empty_bid_set";

    public EmptyBidSetException(Object value) {
        super(CODE, "bids", value, "At least one bid is required for evaluation");
    }
}
