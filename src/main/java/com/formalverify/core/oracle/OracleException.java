package com.formalverify.core.oracle;

/**
 * Unexpected failure while the oracle answered a query.
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
