package com.procureagent.common.exception;

/**
 * Message sent to a session in a terminal phase.
 */
public class SessionClosedException extends ProcurementException {

    public SessionClosedException(String message) {
        super("Negotiation", message);
    }
}
