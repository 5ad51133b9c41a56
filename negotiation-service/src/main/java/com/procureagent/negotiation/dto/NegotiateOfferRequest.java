package com.procureagent.negotiation.dto;

import com.procureagent.common.evaluation.EvaluationWeights;
import com.procureagent.common.model.Offer;

import java.util.List;

/**
 * Request body for POST /api/v1/offers/negotiate: evaluate, pick the optimal offer and
 * open a negotiation with its vendor.
 */
public record NegotiateOfferRequest(
    String itemSku,
    List<Offer> offers,
    EvaluationWeights weights,
    Double scoreScale,
    double targetPrice,
    int quantity
) {}
