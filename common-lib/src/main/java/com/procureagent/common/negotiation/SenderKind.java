package com.procureagent.common.negotiation;

public enum SenderKind {
    BUYER,
    VENDOR,
    /** Lifecycle notices written by the session manager itself. */
    SYSTEM
}
