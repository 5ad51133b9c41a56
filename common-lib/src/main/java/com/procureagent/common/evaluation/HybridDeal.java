package com.procureagent.common.evaluation;

import java.util.List;
import java.util.Map;

/**
 * Synthetic deal assembled from the top-ranked offers.
 *
 * <p>{@code sources} maps each criterion ({@code price}, {@code deliveryDays},
 * {@code reliabilityScore}, {@code pastPerformance}, {@code terms}) to the vendor that
 * contributed it. {@code hybrid} is false when a single vendor supplied every criterion.
 */
public record HybridDeal(
    double price,
    int deliveryDays,
    double reliabilityScore,
    double pastPerformance,
    Map<String, Object> terms,
    Map<String, String> sources,
    List<String> participatingVendors,
    boolean hybrid,
    EvaluationResult anchor
) {}
