package com.procureagent.negotiation.model;

/**
 * Portfolio statistics over every session the manager knows about.
 * Savings are totals over the ordered quantity of agreed sessions.
 */
public record NegotiationStats(
    int totalSessions,
    int activeSessions,
    int agreedSessions,
    int failedSessions,
    int expiredSessions,
    double totalSavings,
    double averageSavingsPerAgreement,
    double successRatePercent
) {}
