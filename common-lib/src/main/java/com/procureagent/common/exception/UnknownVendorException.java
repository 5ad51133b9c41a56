package com.procureagent.common.exception;

public class UnknownVendorException extends ProcurementException {

    public UnknownVendorException(String message) {
        super("Negotiation", message);
    }
}
