package com.bidplatform.evaluation.config;

import com.bidplatform.common.engine.EvaluationEngine;
import com.bidplatform.common.model.Bid;
import com.bidplatform.common.model.EvaluationCriteria;
import com.bidplatform.common.model.EvaluationRequest;
import com.bidplatform.common.model.EvaluationResult;
import com.bidplatform.common.model.Recommendation;
import com.bidplatform.common.policy.ScoringPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Binding of {@code evaluation.*} properties into the policy and engine beans.
 */
class EvaluationConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(EvaluationConfig.class);

    private static final EvaluationRequest EXPERIENCE_ONLY = EvaluationRequest.of(
        EvaluationCriteria.of(0, 0, 0, 100, 0),
        List.of(Bid.of("A", 100.0, "2024-01-01", List.of(), List.of(), null)
                   .withSupplier("SUP-1", "Helio Panels")));

    @Test
    @DisplayName("no properties → default policy")
    void defaults() {
        runner.run(ctx -> {
            assertEquals(ScoringPolicy.defaults(), ctx.getBean(ScoringPolicy.class));
            EvaluationResult result = ctx.getBean(EvaluationEngine.class).evaluate("RFQ", "t", EXPERIENCE_ONLY);
            assertEquals(75.0, result.evaluations().get(0).experienceScore());
        });
    }

    @Test
    @DisplayName("policy overrides and supplier history are applied")
    void overrides() {
        runner.withPropertyValues(
                "evaluation.policy.award-threshold=95",
                "evaluation.policy.shortlist-threshold=80",
                "evaluation.supplier-history[SUP-1]=90")
            .run(ctx -> {
                ScoringPolicy policy = ctx.getBean(ScoringPolicy.class);
                assertEquals(95.0, policy.awardThreshold());
                assertEquals(80.0, policy.shortlistThreshold());

                EvaluationResult result = ctx.getBean(EvaluationEngine.class).evaluate("RFQ", "t", EXPERIENCE_ONLY);
                assertEquals(90.0, result.evaluations().get(0).totalScore());
                assertEquals(Recommendation.SHORTLIST, result.evaluations().get(0).recommendation());
            });
    }

    @Test
    @DisplayName("inverted thresholds fail startup")
    void invalidPolicy() {
        runner.withPropertyValues(
                "evaluation.policy.award-threshold=60",
                "evaluation.policy.shortlist-threshold=80")
            .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }
}
