package com.procureagent.negotiation.config;

import java.time.Duration;

/**
 * @param maxRounds      buyer messages allowed before the session fails
 * @param priceTolerance fraction above the target price still treated as on target
 * @param idleTimeout    inactivity after which a session expires
 */
public record NegotiationSettings(
    int maxRounds,
    double priceTolerance,
    Duration idleTimeout
) {
    public static final int      DEFAULT_MAX_ROUNDS      = 6;
    public static final double   DEFAULT_PRICE_TOLERANCE = 0.05;
    public static final Duration DEFAULT_IDLE_TIMEOUT    = Duration.ofMinutes(30);

    public static NegotiationSettings defaults() {
        return new NegotiationSettings(DEFAULT_MAX_ROUNDS, DEFAULT_PRICE_TOLERANCE, DEFAULT_IDLE_TIMEOUT);
    }
}
