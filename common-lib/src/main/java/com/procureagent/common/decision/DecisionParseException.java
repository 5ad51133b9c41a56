package com.procureagent.common.decision;

/** Coercion failure of a single decision entry. Never leaves the validator. */
class DecisionParseException extends RuntimeException {

    DecisionParseException(String message) {
        super(message);
    }
}
