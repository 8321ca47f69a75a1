package com.bidplatform.common.validation;

import com.bidplatform.common.exception.EmptyBidSetException;
import com.bidplatform.common.exception.MalformedBidException;
import com.bidplatform.common.model.Bid;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All-or-nothing validation of the bid set. The first offending bid aborts the run;
 * nothing is scored until every bid has passed.
 *
 * <p>Rules:
 * <ul>
 *   <li>at least one bid</li>
 *   <li>non-blank id, unique within the request</li>
 *   <li>{@code unit_price} present, finite, ≥ 0</li>
 *   <li>{@code delivery_date} parseable by {@link DeliveryDateParser} and representable in epoch millis</li>
 *   <li>{@code sustainability_score}, when declared, within [0, 100]</li>
 * </ul>
 */
public final class BidValidator {

    private BidValidator() {}

    public static List<ValidatedBid> validate(List<Bid> bids) {
        if (bids == null || bids.isEmpty()) {
            throw new EmptyBidSetException(bids == null ? null : List.of());
        }

        List<ValidatedBid> validated = new ArrayList<>(bids.size());
        Set<String> seenIds = new HashSet<>();
        for (int i = 0; i < bids.size(); i++) {
            Bid bid = bids.get(i);
            if (bid == null) {
                throw new MalformedBidException(null, "bids[" + i + "]", null, "bid entry is null");
            }
            String id = bid.id();
            if (id == null || id.isBlank()) {
                throw new MalformedBidException(id, "id", id, "bid at index " + i + " has no id");
            }
            if (!seenIds.add(id)) {
                throw new MalformedBidException(id, "id", id, "duplicate bid id");
            }
            validated.add(new ValidatedBid(bid, requirePrice(bid), requireDelivery(bid)));
            requireSustainability(bid);
        }
        return validated;
    }

    private static double requirePrice(Bid bid) {
        Double price = bid.unitPrice();
        if (price == null || !Double.isFinite(price) || price < 0.0) {
            throw new MalformedBidException(bid.id(), "unit_price", price,
                "unit_price must be a non-negative number");
        }
        return price;
    }

    private static long requireDelivery(Bid bid) {
        Instant delivery = DeliveryDateParser.parse(bid.deliveryDate())
            .orElseThrow(() -> new MalformedBidException(bid.id(), "delivery_date", bid.deliveryDate(),
                "delivery_date is not a recognised date"));
        try {
            return delivery.toEpochMilli();
        } catch (ArithmeticException e) {
            throw new MalformedBidException(bid.id(), "delivery_date", bid.deliveryDate(),
                "delivery_date is outside the supported range");
        }
    }

    private static void requireSustainability(Bid bid) {
        Double declared = bid.sustainabilityScore();
        if (declared != null && (!Double.isFinite(declared) || declared < 0.0 || declared > 100.0)) {
            throw new MalformedBidException(bid.id(), "sustainability_score", declared,
                "sustainability_score must be within [0, 100]");
        }
    }
}
