package com.bidplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One supplier's offer for an RFQ, as received on the wire.
 *
 * <p>{@code unitPrice} and {@code deliveryDate} are kept in their raw form here;
 * {@link com.bidplatform.common.validation.BidValidator} rejects values that are missing,
 * negative or unparseable before any scoring happens.
 *
 * <p>{@code supplierId}, {@code supplierName}, {@code currency} and {@code totalPrice} are
 * advisory. {@code supplierId} is the lookup key for supplier-history experience scoring.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bid(
    @JsonProperty("id")                        String id,
    @JsonProperty("supplier_id")               String supplierId,
    @JsonProperty("supplier_name")             String supplierName,
    @JsonProperty("unit_price")                Double unitPrice,
    @JsonProperty("total_price")               Double totalPrice,
    @JsonProperty("currency")                  String currency,
    @JsonProperty("delivery_date")             String deliveryDate,
    @JsonProperty("specifications_compliance") List<SpecificationCompliance> specificationsCompliance,
    @JsonProperty("certifications")            List<String> certifications,
    @JsonProperty("sustainability_score")      Double sustainabilityScore
) {
    public Bid {
        specificationsCompliance = specificationsCompliance == null ? List.of() : List.copyOf(specificationsCompliance);
        certifications           = certifications == null ? List.of() : List.copyOf(certifications);
    }

    /**
     * Factory for the fields that drive scoring; advisory supplier fields default to {@code null}.
     */
    public static Bid of(String id, Double unitPrice, String deliveryDate,
                         List<SpecificationCompliance> compliance,
                         List<String> certifications,
                         Double sustainabilityScore) {
        return new Bid(id, null, null, unitPrice, null, null, deliveryDate,
                       compliance, certifications, sustainabilityScore);
    }

    public Bid withSupplier(String supplierId, String supplierName) {
        return new Bid(id, supplierId, supplierName, unitPrice, totalPrice, currency, deliveryDate,
                       specificationsCompliance, certifications, sustainabilityScore);
    }
}
