package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Full response of one evaluation run. {@code evaluations} is ordered by ranking ascending.
 */
public record EvaluationResult(
    @JsonProperty("rfq_id")       String rfqId,
    @JsonProperty("evaluated_at") Instant evaluatedAt,
    @JsonProperty("evaluator_id") String evaluatorId,
    @JsonProperty("criteria")     EvaluationCriteria criteria,
    @JsonProperty("evaluations")  List<BidEvaluation> evaluations,
    @JsonProperty("summary")      EvaluationSummary summary
) {}
