package com.bidplatform.evaluation.service;

import com.bidplatform.common.engine.EvaluationEngine;
import com.bidplatform.common.exception.EvaluationException;
import com.bidplatform.common.model.EvaluationRequest;
import com.bidplatform.common.model.EvaluationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs the evaluation engine off the event loop and logs the outcome.
 * Holds no state between calls.
 */
@Service
public class BidEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(BidEvaluationService.class);

    private final EvaluationEngine engine;

    public BidEvaluationService(EvaluationEngine engine) {
        this.engine = engine;
    }

    public Mono<EvaluationResult> evaluate(String rfqId, String evaluatorId, EvaluationRequest request) {
        int bidCount = request.bids() == null ? 0 : request.bids().size();
        log.info("Evaluating bids. rfqId={} bids={} evaluator={}", rfqId, bidCount, evaluatorId);
        long start = System.currentTimeMillis();

        return Mono.fromCallable(() -> engine.evaluate(rfqId, evaluatorId, request))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(result -> log.info(
                "Completed bid evaluation. rfqId={} bids={} winner={} score={} awards={} shortlisted={} rejected={} latencyMs={}",
                rfqId, result.summary().totalBids(), result.summary().winningBidId(),
                result.summary().winningScore(), result.summary().recommendedAwards(),
                result.summary().shortlisted(), result.summary().rejected(),
                System.currentTimeMillis() - start))
            .doOnError(EvaluationException.class, e -> log.warn(
                "Evaluation rejected. rfqId={} code={} field={} value={}",
                rfqId, e.getCode(), e.getField(), e.getValue()))
            .doOnError(e -> !(e instanceof EvaluationException),
                e -> log.error("Error evaluating bids. rfqId={}", rfqId, e));
    }
}
