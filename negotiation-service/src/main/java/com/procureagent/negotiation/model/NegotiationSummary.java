package com.procureagent.negotiation.model;

import com.procureagent.common.negotiation.NegotiationPhase;

/**
 * @param savings           {@code initialPrice − currentOffer} per unit; null without an offer
 * @param currentOfferScore evaluator score of the baseline offer re-priced at the current offer;
 *                          null when the session was not started from an evaluated offer
 */
public record NegotiationSummary(
    String sessionId,
    NegotiationPhase phase,
    Double currentOffer,
    int messageCount,
    int roundCount,
    Double savings,
    Double currentOfferScore
) {}
