package com.bidplatform.common.validation;

import com.bidplatform.common.exception.InvalidCriteriaException;
import com.bidplatform.common.model.EvaluationCriteria;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CriteriaValidatorTest {

    private static final double TOLERANCE = 0.01;

    @Test
    @DisplayName("equal weights summing to 100 pass")
    void equalWeights_pass() {
        EvaluationCriteria criteria = EvaluationCriteria.equalWeights();
        assertSame(criteria, CriteriaValidator.validate(criteria, TOLERANCE));
    }

    @Test
    @DisplayName("uneven weights summing to 100 pass")
    void unevenWeights_pass() {
        assertDoesNotThrow(() ->
            CriteriaValidator.validate(EvaluationCriteria.of(40, 25, 20, 10, 5), TOLERANCE));
    }

    @Test
    @DisplayName("sum within tolerance passes")
    void withinTolerance_pass() {
        assertDoesNotThrow(() ->
            CriteriaValidator.validate(EvaluationCriteria.of(20, 20, 20, 20, 20.005), TOLERANCE));
    }

    @Test
    @DisplayName("sum just outside tolerance fails")
    void outsideTolerance_fail() {
        assertThrows(InvalidCriteriaException.class, () ->
            CriteriaValidator.validate(EvaluationCriteria.of(20, 20, 20, 20, 20.02), TOLERANCE));
    }

    @Test
    @DisplayName("{20,20,20,20,10} (sum 90) → InvalidCriteria carrying the sum")
    void sumOf90_fails() {
        InvalidCriteriaException ex = assertThrows(InvalidCriteriaException.class, () ->
            CriteriaValidator.validate(EvaluationCriteria.of(20, 20, 20, 20, 10), TOLERANCE));
        assertEquals("invalid_criteria", ex.getCode());
        assertEquals("total_weight", ex.getField());
        assertEquals(90.0, (Double) ex.getValue(), 1e-9);
    }

    @Test
    @DisplayName("negative weight fails even when the sum is 100")
    void negativeWeight_fails() {
        InvalidCriteriaException ex = assertThrows(InvalidCriteriaException.class, () ->
            CriteriaValidator.validate(EvaluationCriteria.of(-10, 30, 40, 20, 20), TOLERANCE));
        assertEquals("price_weight", ex.getField());
    }

    @Test
    @DisplayName("NaN weight fails")
    void nanWeight_fails() {
        InvalidCriteriaException ex = assertThrows(InvalidCriteriaException.class, () ->
            CriteriaValidator.validate(EvaluationCriteria.of(20, 20, Double.NaN, 20, 20), TOLERANCE));
        assertEquals("quality_weight", ex.getField());
    }

    @Test
    @DisplayName("null criteria fails")
    void nullCriteria_fails() {
        InvalidCriteriaException ex = assertThrows(InvalidCriteriaException.class, () ->
            CriteriaValidator.validate(null, TOLERANCE));
        assertEquals("criteria", ex.getField());
    }
}
