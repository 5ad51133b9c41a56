package com.procureagent.common.exception;

/**
 * Every offer in a non-empty batch was rejected.
 */
public class NoValidOffersException extends ProcurementException {

    public NoValidOffersException(String message) {
        super("OfferEvaluator", message);
    }
}
