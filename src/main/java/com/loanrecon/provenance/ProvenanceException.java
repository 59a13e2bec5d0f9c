package com.loanrecon.provenance;

/**
 * A calculation graph is malformed (wrong arity, several terminals, arithmetic failure).
 * Scoped to one attribute's trace; the run continues.
 */
public class ProvenanceException extends RuntimeException {

    public ProvenanceException(String message) {
        super(message);
    }
}
