package com.formalverify.core.action;

/**
 * Raised when the top-level request shape is malformed (missing or non-list
 * {@code actions}, unreadable targets). No step is run when this is thrown.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
