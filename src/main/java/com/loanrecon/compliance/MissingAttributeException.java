package com.loanrecon.compliance;

/**
 * A rule needs an attribute (or calculation trace) the reconciled record does not have.
 * Always reported as ERROR, never as FAIL.
 */
public class MissingAttributeException extends RuntimeException {

    private final String attributeName;

    public MissingAttributeException(String attributeName, String message) {
        super(message);
        this.attributeName = attributeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
