package com.loanrecon.ingestion.oracle;

/**
 * Non-retryable oracle failure (rejected request, malformed or unparseable response).
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
