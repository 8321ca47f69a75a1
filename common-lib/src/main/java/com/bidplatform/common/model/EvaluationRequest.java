package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one evaluation run. {@code evaluatorNotes} is keyed by bid id and is
 * only copied into the per-bid notes; it never affects scoring.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationRequest(
    @JsonProperty("criteria")        EvaluationCriteria criteria,
    @JsonProperty("bids")            List<Bid> bids,
    @JsonProperty("evaluator_notes") Map<String, String> evaluatorNotes
) {
    public EvaluationRequest {
        Map<String, String> notes = new LinkedHashMap<>();
        if (evaluatorNotes != null) {
            evaluatorNotes.forEach((bidId, note) -> {
                if (bidId != null && note != null) notes.put(bidId, note);
            });
        }
        evaluatorNotes = Collections.unmodifiableMap(notes);
    }

    public static EvaluationRequest of(EvaluationCriteria criteria, List<Bid> bids) {
        return new EvaluationRequest(criteria, bids, Map.of());
    }
}
