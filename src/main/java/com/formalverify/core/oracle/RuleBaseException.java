package com.formalverify.core.oracle;

/**
 * The rule base resource is missing or does not describe a usable rule set.
 */
public class RuleBaseException extends RuntimeException {

    public RuleBaseException(String message) {
        super(message);
    }

    public RuleBaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
