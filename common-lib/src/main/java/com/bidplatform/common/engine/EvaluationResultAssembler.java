package com.bidplatform.common.engine;

import com.bidplatform.common.model.BidEvaluation;
import com.bidplatform.common.model.EvaluationCriteria;
import com.bidplatform.common.model.EvaluationResult;
import com.bidplatform.common.model.EvaluationSummary;

import java.time.Instant;
import java.util.List;

/**
 * Packages ranked evaluations with a derived summary. The winner is the rank-1 entry.
 */
public final class EvaluationResultAssembler {

    private EvaluationResultAssembler() {}

    public static EvaluationResult assemble(String rfqId, Instant evaluatedAt, String evaluatorId,
                                            EvaluationCriteria criteria,
                                            List<BidEvaluation> ranked) {
        return new EvaluationResult(rfqId, evaluatedAt, evaluatorId, criteria, ranked, summarize(ranked));
    }

    static EvaluationSummary summarize(List<BidEvaluation> ranked) {
        if (ranked.isEmpty()) {
            throw new IllegalStateException("cannot summarize an empty evaluation list");
        }
        int awards = 0;
        int shortlisted = 0;
        int rejected = 0;
        for (BidEvaluation e : ranked) {
            switch (e.recommendation()) {
                case AWARD     -> awards++;
                case SHORTLIST -> shortlisted++;
                case REJECT    -> rejected++;
            }
        }
        BidEvaluation winner = ranked.get(0);
        return new EvaluationSummary(ranked.size(), awards, shortlisted, rejected,
                                     winner.bidId(), winner.totalScore());
    }
}
