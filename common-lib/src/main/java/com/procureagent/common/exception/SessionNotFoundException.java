package com.procureagent.common.exception;

public class SessionNotFoundException extends ProcurementException {

    public SessionNotFoundException(String message) {
        super("Negotiation", message);
    }
}
