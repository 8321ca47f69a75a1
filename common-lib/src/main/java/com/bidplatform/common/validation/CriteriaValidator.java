package com.bidplatform.common.validation;

import com.bidplatform.common.exception.InvalidCriteriaException;
import com.bidplatform.common.model.EvaluationCriteria;

/**
 * Checks that criteria weights are non-negative and sum to 100 within a tolerance.
 * Stateless; must run before any bid is scored.
 */
public final class CriteriaValidator {

    private static final double TOTAL = 100.0;

    private CriteriaValidator() {}

    /**
     * @param criteria  weights to check
     * @param tolerance allowed |sum − 100|
     * @return the same criteria, for chaining
     * @throws InvalidCriteriaException on a null criteria block, a negative or non-finite
     *                                  weight, or a sum outside the tolerance
     */
    public static EvaluationCriteria validate(EvaluationCriteria criteria, double tolerance) {
        if (criteria == null) {
            throw new InvalidCriteriaException("criteria", null, "Evaluation criteria are required");
        }
        requireWeight("price_weight", criteria.priceWeight());
        requireWeight("delivery_weight", criteria.deliveryWeight());
        requireWeight("quality_weight", criteria.qualityWeight());
        requireWeight("experience_weight", criteria.experienceWeight());
        requireWeight("sustainability_weight", criteria.sustainabilityWeight());

        double sum = criteria.totalWeight();
        if (Math.abs(sum - TOTAL) > tolerance) {
            throw new InvalidCriteriaException("total_weight", sum,
                "Evaluation criteria weights must sum to 100, got " + sum);
        }
        return criteria;
    }

    private static void requireWeight(String field, double weight) {
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new InvalidCriteriaException(field, weight,
                field + " must be a non-negative number, got " + weight);
        }
    }
}
