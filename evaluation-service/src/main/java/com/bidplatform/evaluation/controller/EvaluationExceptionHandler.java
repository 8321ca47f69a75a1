package com.bidplatform.evaluation.controller;

import com.bidplatform.common.exception.EvaluationException;
import com.bidplatform.common.exception.InvalidCriteriaException;
import com.bidplatform.common.exception.MalformedBidException;
import com.bidplatform.evaluation.dto.ErrorResponse;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps input errors to 400 responses. Anything else falls through to Spring's default handling.
 *
 * <p>A JSON value of the wrong type under {@code criteria} or {@code bids[i]} never reaches the
 * engine; it is reported with the same code, field and value the engine would have used.
 */
@RestControllerAdvice
public class EvaluationExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EvaluationExceptionHandler.class);

    static final String MALFORMED_REQUEST = "malformed_request";

    @ExceptionHandler(EvaluationException.class)
    public ResponseEntity<ErrorResponse> handleEvaluation(EvaluationException ex) {
        String bidId = ex instanceof MalformedBidException mb ? mb.getBidId() : null;
        ErrorResponse body = new ErrorResponse(ex.getCode(), ex.getMessage(), ex.getField(),
            ex.getValue() == null ? null : String.valueOf(ex.getValue()), bidId);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(ServerWebInputException ex) {
        MismatchedInputException mismatch = findMismatch(ex);
        EvaluationException translated = mismatch == null ? null : translate(mismatch);
        if (translated != null) {
            log.warn("Rejected evaluation request. code={} field={} value={}",
                translated.getCode(), translated.getField(), translated.getValue());
            return handleEvaluation(translated);
        }
        log.warn("Unreadable evaluation request. reason={}", ex.getReason());
        ErrorResponse body = new ErrorResponse(MALFORMED_REQUEST, ex.getReason(), null, null, null);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    private static MismatchedInputException findMismatch(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof MismatchedInputException mismatch) {
                return mismatch;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    /**
     * Turns a type mismatch into the engine's own error, keyed on the first path segment.
     * Returns {@code null} when the path does not end in a named field of the criteria or a bid.
     */
    static EvaluationException translate(MismatchedInputException ex) {
        List<JsonMappingException.Reference> path = ex.getPath();
        if (path.isEmpty()) {
            return null;
        }
        String root = path.get(0).getFieldName();
        String field = path.get(path.size() - 1).getFieldName();
        if (field == null) {
            return null;
        }
        Object value = ex instanceof InvalidFormatException invalid ? invalid.getValue() : null;
        String message = describe(path) + " is not a valid " + targetName(ex);
        if ("criteria".equals(root)) {
            return new InvalidCriteriaException(field, value, message);
        }
        if ("bids".equals(root)) {
            return new MalformedBidException(null, field, value, message);
        }
        return null;
    }

    private static String describe(List<JsonMappingException.Reference> path) {
        StringBuilder sb = new StringBuilder();
        for (JsonMappingException.Reference ref : path) {
            if (ref.getFieldName() != null) {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                sb.append('[').append(ref.getIndex()).append(']');
            }
        }
        return sb.toString();
    }

    private static String targetName(MismatchedInputException ex) {
        Class<?> target = ex.getTargetType();
        if (target == null) {
            return "value";
        }
        return Number.class.isAssignableFrom(target) || target == double.class ? "number"
            : target.getSimpleName();
    }
}
