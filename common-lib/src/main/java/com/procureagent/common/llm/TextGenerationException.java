package com.procureagent.common.llm;

import com.procureagent.common.exception.ProcurementException;

/**
 * Single failed call to the text-generation collaborator.
 */
public class TextGenerationException extends ProcurementException {

    public enum Kind {
        RATE_LIMITED,
        UNAUTHORIZED,
        SERVER_ERROR,
        TIMEOUT,
        TRANSPORT,
        INVALID_REQUEST,
        EMPTY_RESPONSE;

        /** Worth another attempt after a backoff. */
        public boolean isTransient() {
            return this == RATE_LIMITED || this == SERVER_ERROR || this == TIMEOUT || this == TRANSPORT;
        }
    }

    private final Kind kind;

    public TextGenerationException(Kind kind, String message) {
        super("TextGeneration", kind + ": " + message);
        this.kind = kind;
    }

    public TextGenerationException(Kind kind, String message, Throwable cause) {
        super("TextGeneration", kind + ": " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }
}
