package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Node of a per-attribute provenance DAG. Parents are referenced by step id, never by object.
 */
@NoArgsConstructor
@Getter
@Setter
public class CalculationStep {

    private String stepId;
    /** 1-based evaluation order (topological). */
    private int order;
    private Kind kind;
    private String description;
    private BigDecimal value;
    private String documentId;
    private Integer page;
    /** Rendered formula, e.g. "SUM(base, addback)" or "adjusted × 1.05". */
    private String formula;
    private String rationale;
    private List<String> parentStepIds = new ArrayList<>();

    public enum Kind {
        SOURCE,
        FORMULA,
        ADJUSTMENT
    }
}
