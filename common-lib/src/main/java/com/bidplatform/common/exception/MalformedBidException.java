package com.bidplatform.common.exception;

/**
 * A single bid has a missing, unparseable or out-of-range field.
 */
public class MalformedBidException extends EvaluationException {

    public static final String CODE = "malformed_bid";

    private final String bidId;

    public MalformedBidException(String bidId, String field, Object value, String message) {
        super(CODE, field, value, bidId == null ? message : "bid " + bidId + ": " + message);
        this.bidId = bidId;
    }

    public String getBidId() {
        return bidId;
    }
}
