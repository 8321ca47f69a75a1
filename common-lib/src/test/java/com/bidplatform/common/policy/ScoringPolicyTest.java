package com.bidplatform.common.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScoringPolicyTest {

    @Test
    @DisplayName("defaults carry the standard constants")
    void defaults() {
        ScoringPolicy policy = ScoringPolicy.defaults();
        assertEquals(0.01, policy.weightTolerance());
        assertEquals(70.0, policy.complianceWeight());
        assertEquals(10.0, policy.certificationBonus());
        assertEquals(30.0, policy.maxCertificationBonus());
        assertEquals(100.0, policy.maxQualityScore());
        assertEquals(85.0, policy.awardThreshold());
        assertEquals(70.0, policy.shortlistThreshold());
    }

    @Test
    @DisplayName("shortlist above award is rejected")
    void invertedThresholds() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringPolicy(0.01, 70, 10, 30, 100, 60, 80, 75, 60));
    }

    @Test
    @DisplayName("threshold outside [0, 100] is rejected")
    void thresholdOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringPolicy(0.01, 70, 10, 30, 100, 120, 70, 75, 60));
    }

    @Test
    @DisplayName("negative tolerance is rejected")
    void negativeTolerance() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringPolicy(-0.1, 70, 10, 30, 100, 85, 70, 75, 60));
    }
}
