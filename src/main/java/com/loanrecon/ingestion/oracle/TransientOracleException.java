package com.loanrecon.ingestion.oracle;

/**
 * Oracle failure worth retrying: timeout, throttling (429), 5xx or connection error.
 */
public class TransientOracleException extends OracleException {

    public TransientOracleException(String message) {
        super(message);
    }

    public TransientOracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
