package com.procureagent.common.exception;

/**
 * A non-terminal session already exists for the same item and vendor.
 */
public class DuplicateSessionException extends ProcurementException {

    public DuplicateSessionException(String message) {
        super("Negotiation", message);
    }
}
