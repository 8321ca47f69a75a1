package com.bidplatform.common.exception;

/**
 * Criteria weights are missing, negative, or do not sum to 100.
 */
public class InvalidCriteriaException extends EvaluationException {

    public static final String CODE = "invalid_criteria";

    public InvalidCriteriaException(String field, Object value, String message) {
        super(CODE, field, value, message);
    }
}
