package com.bidplatform.evaluation.controller;

import com.bidplatform.common.model.EvaluationRequest;
import com.bidplatform.common.model.EvaluationResult;
import com.bidplatform.evaluation.service.BidEvaluationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/rfq")
public class EvaluationController {

    static final String EVALUATOR_HEADER = "X-Evaluator-Id";

    private final BidEvaluationService evaluationService;

    public EvaluationController(BidEvaluationService evaluationService) {
        this.evaluationService = evaluationService;
    }

    @PostMapping("/{rfqId}/evaluate")
    public Mono<ResponseEntity<EvaluationResult>> evaluate(
            @PathVariable String rfqId,
            @RequestBody EvaluationRequest request,
            @RequestHeader(value = EVALUATOR_HEADER, defaultValue = "anonymous") String evaluatorId) {
        return evaluationService.evaluate(rfqId, evaluatorId, request).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
