package com.procureagent.common.exception;

/**
 * A single offer failed validation (non-positive price or delivery days, score out of scale).
 */
public class InvalidOfferException extends ProcurementException {

    public InvalidOfferException(String message) {
        super("OfferEvaluator", message);
    }
}
