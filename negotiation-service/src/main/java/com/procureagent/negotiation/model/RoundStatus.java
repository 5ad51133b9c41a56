package com.procureagent.negotiation.model;

public enum RoundStatus {
    /** Message recorded and, for buyer messages, the vendor replied. */
    COMPLETED,
    /** The vendor reply could not be generated; the session stays open for a retry. */
    COLLABORATOR_FAILED,
    /** The round moved the session into a terminal phase. */
    TERMINATED
}
