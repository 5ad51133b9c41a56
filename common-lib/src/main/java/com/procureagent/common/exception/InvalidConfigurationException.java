package com.procureagent.common.exception;

/**
 * Weight set or evaluation setting rejected before any offer is scored.
 */
public class InvalidConfigurationException extends ProcurementException {

    public InvalidConfigurationException(String message) {
        super("OfferEvaluator", message);
    }
}
