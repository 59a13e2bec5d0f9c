package com.loanrecon.provenance;

import java.util.List;

public class ProvenanceCycleException extends ProvenanceException {

    private final List<String> stepIds;

    public ProvenanceCycleException(List<String> stepIds) {
        super("Calculation steps form a cycle: " + stepIds);
        this.stepIds = List.copyOf(stepIds);
    }

    public List<String> getStepIds() {
        return stepIds;
    }
}
