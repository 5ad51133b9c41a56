package com.procureagent.negotiation.dto;

/**
 * Request body for POST /api/v1/negotiations.
 */
public record StartNegotiationRequest(
    String itemSku,
    String vendorId,
    double initialPrice,
    double targetPrice,
    int quantity
) {}
