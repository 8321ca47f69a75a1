package com.bidplatform.common.scoring;

import com.bidplatform.common.model.Bid;

import java.util.Map;

/**
 * Experience score looked up by {@code supplier_id} in a table of historical supplier scores.
 * Bids without a supplier id, or from suppliers absent from the table, fall through to
 * {@code fallback}.
 */
public final class SupplierHistoryScorer implements BidScorer {

    private final Map<String, Double> historyBySupplier;
    private final BidScorer fallback;

    public SupplierHistoryScorer(Map<String, Double> historyBySupplier, BidScorer fallback) {
        this.historyBySupplier = Map.copyOf(historyBySupplier);
        this.fallback = fallback;
    }

    @Override
    public double score(Bid bid) {
        String supplierId = bid.supplierId();
        Double historical = supplierId == null ? null : historyBySupplier.get(supplierId);
        return historical != null ? Scores.clamp(historical) : fallback.score(bid);
    }
}
