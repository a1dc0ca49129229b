package com.formalverify.orchestrator;

/**
 * A verification run did not finish within the configured request timeout.
 */
public class VerificationTimeoutException extends RuntimeException {

    public VerificationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
