package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a bid's specification-compliance sheet.
 * Only {@code compliant} feeds the quality score; the rest is advisory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpecificationCompliance(
    @JsonProperty("specification_id") String specificationId,
    @JsonProperty("compliant")        boolean compliant,
    @JsonProperty("value")            String value,
    @JsonProperty("notes")            String notes
) {
    public static SpecificationCompliance of(String specificationId, boolean compliant) {
        return new SpecificationCompliance(specificationId, compliant, null, null);
    }
}
