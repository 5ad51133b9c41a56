package com.procureagent.common.exception;

/**
 * Nothing to select or combine.
 */
public class EmptyInputException extends ProcurementException {

    public EmptyInputException(String message) {
        super("OfferEvaluator", message);
    }
}
