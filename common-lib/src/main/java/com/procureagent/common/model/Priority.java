package com.procureagent.common.model;

/**
 * Restock urgency, ordered from least to most urgent.
 */
public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** HIGH and CRITICAL decisions are pushed to the notification dispatcher. */
    public boolean isEscalated() {
        return this == HIGH || this == CRITICAL;
    }
}
