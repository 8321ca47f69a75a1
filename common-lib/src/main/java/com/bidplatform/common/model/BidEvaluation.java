package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scored and ranked output row for one bid. All scores are in [0, 100] and rounded
 * to two decimals; {@code ranking} is 1-based and unique within a result.
 */
public record BidEvaluation(
    @JsonProperty("bid_id")               String bidId,
    @JsonProperty("supplier_id")          String supplierId,
    @JsonProperty("supplier_name")        String supplierName,
    @JsonProperty("price_score")          double priceScore,
    @JsonProperty("delivery_score")       double deliveryScore,
    @JsonProperty("quality_score")        double qualityScore,
    @JsonProperty("experience_score")     double experienceScore,
    @JsonProperty("sustainability_score") double sustainabilityScore,
    @JsonProperty("total_score")          double totalScore,
    @JsonProperty("ranking")              int ranking,
    @JsonProperty("recommendation")       Recommendation recommendation,
    @JsonProperty("notes")                String notes
) {
    /** Copy with ranking and tier filled in; used by the ranker after sorting. */
    public BidEvaluation ranked(int ranking, Recommendation recommendation) {
        return new BidEvaluation(bidId, supplierId, supplierName,
                                 priceScore, deliveryScore, qualityScore,
                                 experienceScore, sustainabilityScore, totalScore,
                                 ranking, recommendation, notes);
    }
}
