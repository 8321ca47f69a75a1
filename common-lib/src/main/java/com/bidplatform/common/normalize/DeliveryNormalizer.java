package com.bidplatform.common.normalize;

import com.bidplatform.common.validation.ValidatedBid;

import java.util.List;

/**
 * Delivery score: the earliest delivery scores 100, the latest 0.
 * Identical delivery dates score 100 across the board.
 */
public final class DeliveryNormalizer {

    private DeliveryNormalizer() {}

    public static double[] normalize(List<ValidatedBid> bids) {
        return MinMaxNormalizer.lowerIsBetter(
            bids.stream().mapToDouble(b -> (double) b.deliveryEpochMs()).toArray());
    }
}
