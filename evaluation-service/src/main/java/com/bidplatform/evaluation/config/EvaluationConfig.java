package com.bidplatform.evaluation.config;

import com.bidplatform.common.engine.EvaluationEngine;
import com.bidplatform.common.engine.WeightedBidEvaluationEngine;
import com.bidplatform.common.policy.ScoringPolicy;
import com.bidplatform.common.scoring.BidScorer;
import com.bidplatform.common.scoring.FixedBidScorer;
import com.bidplatform.common.scoring.SupplierHistoryScorer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EvaluationProperties.class)
public class EvaluationConfig {

    private static final Logger log = LoggerFactory.getLogger(EvaluationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoringPolicy scoringPolicy(EvaluationProperties properties) {
        ScoringPolicy policy = properties.toScoringPolicy();
        log.info("Scoring policy loaded. award>={} shortlist>={} compliance={} certBonus={}/{} tolerance={}",
            policy.awardThreshold(), policy.shortlistThreshold(), policy.complianceWeight(),
            policy.certificationBonus(), policy.maxCertificationBonus(), policy.weightTolerance());
        return policy;
    }

    @Bean
    public EvaluationEngine evaluationEngine(ScoringPolicy policy, EvaluationProperties properties, Clock clock) {
        BidScorer experience = new FixedBidScorer(policy.defaultExperienceScore());
        if (!properties.getSupplierHistory().isEmpty()) {
            log.info("Supplier history scoring enabled for {} suppliers", properties.getSupplierHistory().size());
            experience = new SupplierHistoryScorer(properties.getSupplierHistory(), experience);
        }
        return new WeightedBidEvaluationEngine(policy, experience,
            new FixedBidScorer(policy.defaultSustainabilityScore()), clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
