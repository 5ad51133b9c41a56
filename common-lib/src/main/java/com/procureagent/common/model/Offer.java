package com.procureagent.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A vendor's quote for a purchase request.
 *
 * <p>{@code reliabilityScore} and {@code pastPerformance} share one scale per
 * evaluation call (0–5 by default, 0–10 when the caller says so).
 */
public record Offer(
    String vendorId,
    double price,
    int deliveryDays,
    double reliabilityScore,
    double pastPerformance,
    Map<String, Object> terms,
    OfferStatus status
) {
    @JsonCreator
    public Offer {
        terms  = terms == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(terms));
        status = status == null ? OfferStatus.PENDING : status;
    }

    public Offer(String vendorId, double price, int deliveryDays,
                 double reliabilityScore, double pastPerformance) {
        this(vendorId, price, deliveryDays, reliabilityScore, pastPerformance, Map.of(), OfferStatus.PENDING);
    }

    /** Same quote at a different unit price, marked as countered. */
    public Offer withPrice(double newPrice) {
        return new Offer(vendorId, newPrice, deliveryDays, reliabilityScore, pastPerformance,
                         terms, OfferStatus.COUNTERED);
    }
}
