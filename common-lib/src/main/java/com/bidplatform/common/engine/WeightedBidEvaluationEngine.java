package com.bidplatform.common.engine;

import com.bidplatform.common.exception.InvalidCriteriaException;
import com.bidplatform.common.model.Bid;
import com.bidplatform.common.model.BidEvaluation;
import com.bidplatform.common.model.EvaluationCriteria;
import com.bidplatform.common.model.EvaluationRequest;
import com.bidplatform.common.model.EvaluationResult;
import com.bidplatform.common.normalize.DeliveryNormalizer;
import com.bidplatform.common.normalize.PriceNormalizer;
import com.bidplatform.common.policy.ScoringPolicy;
import com.bidplatform.common.ranking.BidRanker;
import com.bidplatform.common.ranking.RecommendationClassifier;
import com.bidplatform.common.scoring.BidScorer;
import com.bidplatform.common.scoring.CompositeScorer;
import com.bidplatform.common.scoring.DeclaredSustainabilityScorer;
import com.bidplatform.common.scoring.FixedBidScorer;
import com.bidplatform.common.scoring.QualityScorer;
import com.bidplatform.common.scoring.Scores;
import com.bidplatform.common.validation.BidValidator;
import com.bidplatform.common.validation.CriteriaValidator;
import com.bidplatform.common.validation.ValidatedBid;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Default {@link EvaluationEngine}: min-max normalized price and delivery, policy-driven
 * quality, pluggable experience and sustainability, weighted composite, stable ranking.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Validate criteria (weights sum to 100 within {@link ScoringPolicy#weightTolerance()}).</li>
 *   <li>Validate every bid (non-empty set, unique ids, price, delivery date, declared sustainability).</li>
 *   <li>Normalize price and delivery across the bid set.</li>
 *   <li>Score quality, experience and sustainability per bid.</li>
 *   <li>Combine into a weighted total, rank, classify, summarize.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe. With the default scorers it is fully
 * deterministic apart from {@code evaluated_at}, which is read from the injected {@link Clock}.
 */
public class WeightedBidEvaluationEngine implements EvaluationEngine {

    private final ScoringPolicy policy;
    private final QualityScorer qualityScorer;
    private final BidScorer experienceScorer;
    private final BidScorer sustainabilityScorer;
    private final BidRanker ranker;
    private final Clock clock;

    /**
     * Engine with fixed experience and sustainability fallbacks taken from {@code policy}.
     */
    public WeightedBidEvaluationEngine(ScoringPolicy policy, Clock clock) {
        this(policy,
             new FixedBidScorer(policy.defaultExperienceScore()),
             new FixedBidScorer(policy.defaultSustainabilityScore()),
             clock);
    }

    /**
     * @param policy                 quality constants, thresholds and weight tolerance
     * @param experienceScorer       experience source
     * @param sustainabilityFallback used when a bid declares no sustainability score
     * @param clock                  source of {@code evaluated_at}
     */
    public WeightedBidEvaluationEngine(ScoringPolicy policy,
                                       BidScorer experienceScorer,
                                       BidScorer sustainabilityFallback,
                                       Clock clock) {
        this.policy = policy;
        this.qualityScorer = new QualityScorer(policy);
        this.experienceScorer = experienceScorer;
        this.sustainabilityScorer = new DeclaredSustainabilityScorer(sustainabilityFallback);
        this.ranker = new BidRanker(new RecommendationClassifier(policy));
        this.clock = clock;
    }

    @Override
    public EvaluationResult evaluate(String rfqId, String evaluatorId, EvaluationRequest request) {
        if (request == null) {
            throw new InvalidCriteriaException("criteria", null, "Evaluation criteria are required");
        }
        EvaluationCriteria criteria = CriteriaValidator.validate(request.criteria(), policy.weightTolerance());
        List<ValidatedBid> bids = BidValidator.validate(request.bids());

        double[] priceScores = PriceNormalizer.normalize(bids);
        double[] deliveryScores = DeliveryNormalizer.normalize(bids);

        List<BidEvaluation> scored = new ArrayList<>(bids.size());
        for (int i = 0; i < bids.size(); i++) {
            scored.add(score(bids.get(i), criteria, priceScores[i], deliveryScores[i],
                             request.evaluatorNotes()));
        }

        return EvaluationResultAssembler.assemble(rfqId, clock.instant(), evaluatorId,
                                                  criteria, ranker.rank(scored));
    }

    private BidEvaluation score(ValidatedBid validated, EvaluationCriteria criteria,
                                double price, double delivery, Map<String, String> evaluatorNotes) {
        Bid bid = validated.bid();
        double quality        = Scores.clamp(qualityScorer.score(bid));
        double experience     = Scores.clamp(experienceScorer.score(bid));
        double sustainability = Scores.clamp(sustainabilityScorer.score(bid));
        double total = CompositeScorer.combine(criteria, price, delivery, quality, experience, sustainability);

        // ranking and recommendation are assigned by BidRanker
        return new BidEvaluation(bid.id(), bid.supplierId(), bid.supplierName(),
                                 Scores.round2(price), Scores.round2(delivery), Scores.round2(quality),
                                 Scores.round2(experience), Scores.round2(sustainability), total,
                                 0, null, notes(validated, evaluatorNotes.get(bid.id())));
    }

    static String notes(ValidatedBid validated, String evaluatorNote) {
        String price = BigDecimal.valueOf(validated.unitPrice()).stripTrailingZeros().toPlainString();
        String notes = "Price: $" + price + ", Delivery: " + validated.bid().deliveryDate();
        if (evaluatorNote != null && !evaluatorNote.isBlank()) {
            notes += "; Evaluator: " + evaluatorNote.trim();
        }
        return notes;
    }
}
