package com.procureagent.common.exception;

/**
 * Root of the engine's unchecked exception taxonomy.
 * Messages are prefixed with the originating component, e.g. {@code [OfferEvaluator] ...}.
 */
public class ProcurementException extends RuntimeException {
    private final String component;

    public ProcurementException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ProcurementException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
