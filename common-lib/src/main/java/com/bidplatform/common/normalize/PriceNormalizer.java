package com.bidplatform.common.normalize;

import com.bidplatform.common.validation.ValidatedBid;

import java.util.List;

/**
 * Price score: the cheapest bid scores 100, the most expensive 0.
 * Uniform pricing (including a single bid) scores 100 across the board.
 */
public final class PriceNormalizer {

    private PriceNormalizer() {}

    public static double[] normalize(List<ValidatedBid> bids) {
        return MinMaxNormalizer.lowerIsBetter(
            bids.stream().mapToDouble(ValidatedBid::unitPrice).toArray());
    }
}
