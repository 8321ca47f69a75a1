package com.bidplatform.common.policy;

/**
 * Fixed policy values used by the evaluation pipeline.
 *
 * <p><b>Quality</b>:
 * <pre>
 *   qualityScore = min(complianceRate × complianceWeight
 *                      + min(certifications × certificationBonus, maxCertificationBonus),
 *                      maxQualityScore)
 * </pre>
 *
 * <p><b>Classification</b> (inclusive lower bounds, on the rounded total):
 * <pre>
 *   total ≥ awardThreshold      → AWARD
 *   total ≥ shortlistThreshold  → SHORTLIST
 *   otherwise                   → REJECT
 * </pre>
 *
 * <p>{@code defaultExperienceScore} and {@code defaultSustainabilityScore} feed the
 * fixed scorers used when no supplier history or declared sustainability is available.
 *
 * @param weightTolerance            allowed deviation of the criteria weight sum from 100
 * @param complianceWeight           points awarded for a fully compliant bid
 * @param certificationBonus         points per certification
 * @param maxCertificationBonus      cap on the total certification bonus
 * @param maxQualityScore            cap on the quality score
 * @param awardThreshold             lowest total that is recommended for award
 * @param shortlistThreshold         lowest total that is shortlisted
 * @param defaultExperienceScore     experience score when nothing better is known
 * @param defaultSustainabilityScore sustainability score when the bid declares none
 */
public record ScoringPolicy(
    double weightTolerance,
    double complianceWeight,
    double certificationBonus,
    double maxCertificationBonus,
    double maxQualityScore,
    double awardThreshold,
    double shortlistThreshold,
    double defaultExperienceScore,
    double defaultSustainabilityScore
) {
    public static final double WEIGHT_TOLERANCE        = 0.01;
    public static final double COMPLIANCE_WEIGHT       = 70.0;
    public static final double CERTIFICATION_BONUS     = 10.0;
    public static final double MAX_CERTIFICATION_BONUS = 30.0;
    public static final double MAX_QUALITY_SCORE       = 100.0;
    public static final double AWARD_THRESHOLD         = 85.0;
    public static final double SHORTLIST_THRESHOLD     = 70.0;
    public static final double DEFAULT_EXPERIENCE      = 75.0;
    public static final double DEFAULT_SUSTAINABILITY  = 60.0;

    public ScoringPolicy {
        if (weightTolerance < 0.0) {
            throw new IllegalArgumentException("weightTolerance must be >= 0, was " + weightTolerance);
        }
        requireScore("complianceWeight", complianceWeight);
        requireScore("certificationBonus", certificationBonus);
        requireScore("maxCertificationBonus", maxCertificationBonus);
        requireScore("maxQualityScore", maxQualityScore);
        requireScore("awardThreshold", awardThreshold);
        requireScore("shortlistThreshold", shortlistThreshold);
        requireScore("defaultExperienceScore", defaultExperienceScore);
        requireScore("defaultSustainabilityScore", defaultSustainabilityScore);
        if (shortlistThreshold > awardThreshold) {
            throw new IllegalArgumentException("shortlistThreshold (" + shortlistThreshold
                + ") must not exceed awardThreshold (" + awardThreshold + ")");
        }
    }

    public static ScoringPolicy defaults() {
        return new ScoringPolicy(WEIGHT_TOLERANCE, COMPLIANCE_WEIGHT, CERTIFICATION_BONUS,
                                 MAX_CERTIFICATION_BONUS, MAX_QUALITY_SCORE,
                                 AWARD_THRESHOLD, SHORTLIST_THRESHOLD,
                                 DEFAULT_EXPERIENCE, DEFAULT_SUSTAINABILITY);
    }

    private static void requireScore(String name, double value) {
        if (!Double.isFinite(value) || value < 0.0 || value > 100.0) {
            throw new IllegalArgumentException(name + " must be within [0, 100], was " + value);
        }
    }
}
