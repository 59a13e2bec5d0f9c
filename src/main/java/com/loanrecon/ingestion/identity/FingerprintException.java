package com.loanrecon.ingestion.identity;

/**
 * Content could not be fingerprinted (missing content, unreadable image).
 */
public class FingerprintException extends RuntimeException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
