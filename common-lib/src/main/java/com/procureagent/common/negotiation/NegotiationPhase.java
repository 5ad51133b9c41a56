package com.procureagent.common.negotiation;

/**
 * {@code INITIATED → ACTIVE → {AGREED | FAILED | EXPIRED}}. The three outcomes are terminal.
 */
public enum NegotiationPhase {
    INITIATED,
    ACTIVE,
    AGREED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == AGREED || this == FAILED || this == EXPIRED;
    }
}
