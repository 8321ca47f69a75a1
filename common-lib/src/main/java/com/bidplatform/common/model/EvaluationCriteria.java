package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Percentage weighting for one evaluation run. The five weights must sum to 100.
 * A caller-sent {@code total_weight} is ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationCriteria(
    @JsonProperty("price_weight")          double priceWeight,
    @JsonProperty("delivery_weight")       double deliveryWeight,
    @JsonProperty("quality_weight")        double qualityWeight,
    @JsonProperty("experience_weight")     double experienceWeight,
    @JsonProperty("sustainability_weight") double sustainabilityWeight
) {
    public static EvaluationCriteria of(double price, double delivery, double quality,
                                        double experience, double sustainability) {
        return new EvaluationCriteria(price, delivery, quality, experience, sustainability);
    }

    /** Equal 20/20/20/20/20 weighting. */
    public static EvaluationCriteria equalWeights() {
        return new EvaluationCriteria(20, 20, 20, 20, 20);
    }

    public double totalWeight() {
        return priceWeight + deliveryWeight + qualityWeight + experienceWeight + sustainabilityWeight;
    }
}
