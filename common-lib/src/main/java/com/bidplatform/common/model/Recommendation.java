package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recommendation tier derived from a bid's total score.
 */
public enum Recommendation {
    @JsonProperty("award")     AWARD,
    @JsonProperty("shortlist") SHORTLIST,
    @JsonProperty("reject")    REJECT
}
