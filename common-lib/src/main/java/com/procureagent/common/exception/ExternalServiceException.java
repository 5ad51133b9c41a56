package com.procureagent.common.exception;

/**
 * A collaborator call failed after its retry budget was exhausted, or failed with
 * a non-retryable error.
 */
public class ExternalServiceException extends ProcurementException {

    public ExternalServiceException(String component, String message) {
        super(component, message);
    }

    public ExternalServiceException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
