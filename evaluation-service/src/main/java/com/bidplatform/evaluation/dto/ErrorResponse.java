package com.bidplatform.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of a 400 response. {@code error} is a stable machine-readable code:
 * {@code invalid_criteria}, {@code empty_bid_set}, {@code malformed_bid} or {@code malformed_request}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message,
    @JsonProperty("field")   String field,
    @JsonProperty("value")   String value,
    @JsonProperty("bid_id")  String bidId
) {}
