package com.bidplatform.common.exception;

/**
 * Base type for input errors detected before any bid is scored.
 * Carries the offending field and the value that was received so callers
 * can render a precise message.
 */
public class EvaluationException extends RuntimeException {
    private final String code;
    private final String field;
    private final Object value;

    public EvaluationException(String code, String field, Object value, String message) {
        super("[" + code + "] " + message);
        this.code = code;
        this.field = field;
        this.value = value;
    }

    public String getCode() {
        return code;
    }

    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }
}
