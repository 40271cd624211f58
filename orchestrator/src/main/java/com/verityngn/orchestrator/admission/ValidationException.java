package com.verityngn.orchestrator.admission;

/** Malformed submission; rejected immediately and never retried. */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
