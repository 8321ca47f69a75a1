package com.bidplatform.evaluation.config;

import com.bidplatform.common.policy.ScoringPolicy;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Externalized evaluation settings, bound from the {@code evaluation.*} namespace.
 *
 * <p>Every policy field defaults to the {@link ScoringPolicy#defaults()} value, so an empty
 * configuration reproduces the standard 70/10/30 quality split and 85/70 thresholds.
 *
 * <p>{@code supplierHistory} maps supplier id → historical experience score (0–100).
 * When empty, every bid gets {@code policy.defaultExperienceScore}.
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationProperties {

    private Policy policy = new Policy();

    private Map<String, Double> supplierHistory = new HashMap<>();

    @Data
    @NoArgsConstructor
    public static class Policy {

        private double weightTolerance = ScoringPolicy.WEIGHT_TOLERANCE;

        private double complianceWeight = ScoringPolicy.COMPLIANCE_WEIGHT;

        private double certificationBonus = ScoringPolicy.CERTIFICATION_BONUS;

        private double maxCertificationBonus = ScoringPolicy.MAX_CERTIFICATION_BONUS;

        private double maxQualityScore = ScoringPolicy.MAX_QUALITY_SCORE;

        private double awardThreshold = ScoringPolicy.AWARD_THRESHOLD;

        private double shortlistThreshold = ScoringPolicy.SHORTLIST_THRESHOLD;

        private double defaultExperienceScore = ScoringPolicy.DEFAULT_EXPERIENCE;

        private double defaultSustainabilityScore = ScoringPolicy.DEFAULT_SUSTAINABILITY;
    }

    public ScoringPolicy toScoringPolicy() {
        return new ScoringPolicy(policy.weightTolerance, policy.complianceWeight,
                                 policy.certificationBonus, policy.maxCertificationBonus,
                                 policy.maxQualityScore, policy.awardThreshold,
                                 policy.shortlistThreshold, policy.defaultExperienceScore,
                                 policy.defaultSustainabilityScore);
    }
}
