package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view of one evaluation run. Every field is derived from the ranked
 * evaluations by {@link com.bidplatform.common.engine.EvaluationResultAssembler}.
 */
public record EvaluationSummary(
    @JsonProperty("total_bids")         int totalBids,
    @JsonProperty("recommended_awards") int recommendedAwards,
    @JsonProperty("shortlisted")        int shortlisted,
    @JsonProperty("rejected")           int rejected,
    @JsonProperty("winning_bid_id")     String winningBidId,
    @JsonProperty("winning_score")      double winningScore
) {}
