package com.procureagent.common.negotiation;

import java.time.Instant;

/**
 * One entry of a session transcript. Never mutated after it is appended.
 *
 * @param extractedPrice first currency-like amount found in {@code content}; null when none
 */
public record NegotiationMessage(
    String sessionId,
    SenderKind sender,
    String content,
    Instant timestamp,
    Double extractedPrice
) {}
