package com.procureagent.common.negotiation;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a negotiation session, used for API responses and archival.
 *
 * @param currentOffer latest price quoted in the transcript; null until the first one
 * @param savings      {@code initialPrice − currentOffer}; null while there is no offer
 */
public record NegotiationSessionView(
    String sessionId,
    String itemSku,
    String vendorId,
    String vendorName,
    int quantity,
    double initialPrice,
    double targetPrice,
    Double currentOffer,
    Double savings,
    NegotiationPhase phase,
    int roundCount,
    int failedRounds,
    String lastFailure,
    List<NegotiationMessage> messages,
    Instant createdAt,
    Instant updatedAt
) {
    public NegotiationSessionView {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
