package com.loanrecon.provenance;

/**
 * A step references a parent step, document or page that does not exist.
 */
public class MissingReferenceException extends ProvenanceException {

    public MissingReferenceException(String message) {
        super(message);
    }
}
