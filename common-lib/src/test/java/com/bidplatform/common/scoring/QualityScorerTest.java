package com.bidplatform.common.scoring;

import com.bidplatform.common.policy.ScoringPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bidplatform.common.BidFixtures.bid;
import static org.junit.jupiter.api.Assertions.*;

class QualityScorerTest {

    private final QualityScorer scorer = new QualityScorer(ScoringPolicy.defaults());

    @Test
    @DisplayName("fully compliant, no certifications → 70")
    void fullCompliance() {
        assertEquals(70.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(true, true), List.of())), 1e-9);
    }

    @Test
    @DisplayName("half compliant → 35")
    void halfCompliance() {
        assertEquals(35.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(true, false), List.of())), 1e-9);
    }

    @Test
    @DisplayName("empty compliance sheet gives no compliance credit")
    void emptyCompliance() {
        assertEquals(0.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(), List.of())), 1e-9);
        assertEquals(20.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(), List.of("ISO9001", "ISO14001"))), 1e-9);
    }

    @Test
    @DisplayName("certification bonus is capped at 30")
    void certificationCap() {
        assertEquals(30.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(),
            List.of("ISO9001", "ISO14001", "IEC61215", "IEC61730", "UL1703"))), 1e-9);
    }

    @Test
    @DisplayName("full compliance plus capped bonus → 100")
    void maxQuality() {
        assertEquals(100.0, scorer.score(bid("A", 1.0, "2024-01-01", List.of(true),
            List.of("ISO9001", "ISO14001", "IEC61215", "IEC61730"))), 1e-9);
    }

    @Test
    @DisplayName("custom policy is capped at maxQualityScore")
    void customPolicyCapped() {
        ScoringPolicy generous = new ScoringPolicy(0.01, 80, 15, 45, 100, 85, 70, 75, 60);
        QualityScorer custom = new QualityScorer(generous);
        assertEquals(100.0, custom.score(bid("A", 1.0, "2024-01-01", List.of(true), List.of("ISO9001", "ISO14001"))), 1e-9);
        assertEquals(55.0, custom.score(bid("A", 1.0, "2024-01-01", List.of(true, false), List.of("ISO9001"))), 1e-9);
    }
}
