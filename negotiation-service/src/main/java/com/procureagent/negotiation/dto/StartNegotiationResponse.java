package com.procureagent.negotiation.dto;

import com.procureagent.common.evaluation.OptimalOffer;
import com.procureagent.common.negotiation.NegotiationSessionView;

/**
 * @param optimal the evaluated offer the session was seeded from; null for a plain start
 */
public record StartNegotiationResponse(
    String sessionId,
    NegotiationSessionView session,
    OptimalOffer optimal
) {}
