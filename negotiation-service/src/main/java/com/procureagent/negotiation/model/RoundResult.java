package com.procureagent.negotiation.model;

import com.procureagent.common.negotiation.NegotiationMessage;
import com.procureagent.common.negotiation.NegotiationPhase;

/**
 * Outcome of one {@code sendMessage} or {@code retryRound} call.
 *
 * @param message       the message recorded for the caller; null for a retried round
 * @param vendorReply   generated vendor message; null when none was produced
 * @param failureReason collaborator or termination reason; null on a clean round
 */
public record RoundResult(
    NegotiationMessage message,
    NegotiationMessage vendorReply,
    RoundStatus status,
    NegotiationPhase phase,
    Double currentOffer,
    String failureReason
) {}
