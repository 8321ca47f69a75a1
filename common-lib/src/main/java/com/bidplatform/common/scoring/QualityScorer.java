package com.bidplatform.common.scoring;

import com.bidplatform.common.model.Bid;
import com.bidplatform.common.model.SpecificationCompliance;
import com.bidplatform.common.policy.ScoringPolicy;

/**
 * Quality score from specification compliance plus a capped certification bonus.
 *
 * <pre>
 *   complianceRate     = compliant / max(requirements, 1)
 *   certificationBonus = min(certifications × 10, 30)
 *   qualityScore       = min(complianceRate × 70 + certificationBonus, 100)
 * </pre>
 *
 * Constants come from {@link ScoringPolicy}; the values above are the defaults.
 * An empty compliance sheet yields no compliance credit.
 */
public final class QualityScorer implements BidScorer {

    private final ScoringPolicy policy;

    public QualityScorer(ScoringPolicy policy) {
        this.policy = policy;
    }

    @Override
    public double score(Bid bid) {
        double rate = complianceRate(bid);
        double bonus = Math.min(bid.certifications().size() * policy.certificationBonus(),
                                policy.maxCertificationBonus());
        return Math.min(rate * policy.complianceWeight() + bonus, policy.maxQualityScore());
    }

    static double complianceRate(Bid bid) {
        long compliant = bid.specificationsCompliance().stream()
            .filter(SpecificationCompliance::compliant)
            .count();
        return (double) compliant / Math.max(bid.specificationsCompliance().size(), 1);
    }
}
