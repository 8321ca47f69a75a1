package com.bidplatform.common.validation;

import com.bidplatform.common.model.Bid;

/**
 * A bid whose price and delivery date have been checked and parsed.
 *
 * @param bid            the original bid
 * @param unitPrice      finite, non-negative unit price
 * @param deliveryEpochMs delivery date on a linear millisecond scale
 */
public record ValidatedBid(Bid bid, double unitPrice, long deliveryEpochMs) {
}
