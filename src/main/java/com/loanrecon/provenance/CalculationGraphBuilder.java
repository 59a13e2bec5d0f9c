package com.loanrecon.provenance;

import com.loanrecon.domain.CalculationStep;
import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.ExtractedField;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.provenance.config.ProvenanceProperties.CalculationRecipe;
import com.loanrecon.provenance.config.ProvenanceProperties.StepDefinition;
import com.loanrecon.reconciliation.MasterDocumentIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds and verifies one attribute's provenance DAG from its recipe:
 * validate references → topological order (cycle check) → single terminal → evaluate → compare with the
 * authoritative attribute. Structural failures yield a VERIFICATION_ERROR trace rather than an exception.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CalculationGraphBuilder {

    private final ToleranceVerifier toleranceVerifier;

    public CalculationTrace build(RunContext ctx, CalculationRecipe recipe, MasterDocumentIndex masters) {
        CalculationTrace trace = new CalculationTrace();
        trace.setId(ctx.getLoanId() + ":" + recipe.getAttribute());
        trace.setLoanId(ctx.getLoanId());
        trace.setExecutionId(ctx.getExecutionId());
        trace.setAttributeName(recipe.getAttribute());
        trace.setBuiltAt(Instant.now());
        try {
            Map<String, StepDefinition> defs = indexSteps(recipe.getSteps());
            validateParents(defs);
            List<String> order = topologicalOrder(defs);
            String terminal = singleTerminal(defs);
            Map<String, CalculationStep> steps = new LinkedHashMap<>();
            boolean missingInput = false;
            for (int i = 0; i < order.size(); i++) {
                StepDefinition def = defs.get(order.get(i));
                CalculationStep step = evaluate(ctx, def, steps, masters);
                step.setOrder(i + 1);
                steps.put(def.getId(), step);
                if (step.getValue() == null) {
                    missingInput = true;
                }
            }
            trace.setSteps(new ArrayList<>(steps.values()));
            trace.setTerminalStepId(terminal);
            BigDecimal calculated = missingInput ? null : steps.get(terminal).getValue();
            trace.setCalculatedValue(calculated);
            trace.setExpectedValue(expectedValue(ctx, recipe));
            if (missingInput) {
                trace.setStatus(VerificationStatus.MISSING_INPUT);
                trace.setErrorMessage("One or more source values are missing");
            } else {
                VerificationOutcome outcome = toleranceVerifier.verify(calculated, trace.getExpectedValue());
                trace.setStatus(outcome.status());
                trace.setAbsoluteDifference(outcome.absoluteDifference());
                trace.setVariancePct(outcome.variancePct());
                if (outcome.status() == VerificationStatus.MISSING_INPUT) {
                    trace.setErrorMessage("Authoritative value " + recipe.effectiveExpectedAttribute() + " is unsourced");
                }
            }
        } catch (ProvenanceException e) {
            trace.setStatus(VerificationStatus.VERIFICATION_ERROR);
            trace.setErrorMessage(e.getMessage());
        }
        return trace;
    }

    private static Map<String, StepDefinition> indexSteps(List<StepDefinition> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new ProvenanceException("Recipe has no steps");
        }
        Map<String, StepDefinition> defs = new LinkedHashMap<>();
        for (StepDefinition s : steps) {
            if (s.getId() == null || s.getId().isBlank()) {
                throw new ProvenanceException("Step without id");
            }
            if (s.getKind() == null) {
                throw new ProvenanceException("Step " + s.getId() + " has no kind");
            }
            if (defs.putIfAbsent(s.getId(), s) != null) {
                throw new ProvenanceException("Duplicate step id " + s.getId());
            }
        }
        return defs;
    }

    private static void validateParents(Map<String, StepDefinition> defs) {
        for (StepDefinition s : defs.values()) {
            List<String> parents = parentsOf(s);
            for (String p : parents) {
                if (!defs.containsKey(p)) {
                    throw new MissingReferenceException("Step " + s.getId() + " references unknown step " + p);
                }
            }
            switch (s.getKind()) {
                case SOURCE -> {
                    if (!parents.isEmpty()) {
                        throw new ProvenanceException("SOURCE step " + s.getId() + " cannot have parents");
                    }
                }
                case FORMULA -> {
                    if (s.getFormula() == null) {
                        throw new ProvenanceException("FORMULA step " + s.getId() + " has no formula");
                    }
                    if (!s.getFormula().acceptsArity(parents.size())) {
                        throw new ProvenanceException(s.getFormula() + " in step " + s.getId() + " takes "
                                + s.getFormula().arityDescription() + " parents, got " + parents.size());
                    }
                }
                case ADJUSTMENT -> {
                    if (parents.size() != 1 || s.getFactor() == null) {
                        throw new ProvenanceException("ADJUSTMENT step " + s.getId() + " needs one parent and a factor");
                    }
                }
            }
        }
    }

    /** Kahn's algorithm; ready steps are taken in declaration order. */
    static List<String> topologicalOrder(Map<String, StepDefinition> defs) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> children = new HashMap<>();
        for (StepDefinition s : defs.values()) {
            inDegree.put(s.getId(), new HashSet<>(parentsOf(s)).size());
            for (String p : new HashSet<>(parentsOf(s))) {
                children.computeIfAbsent(p, k -> new ArrayList<>()).add(s.getId());
            }
        }
        List<String> order = new ArrayList<>();
        Set<String> done = new HashSet<>();
        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (String id : defs.keySet()) {
                if (!done.contains(id) && inDegree.get(id) == 0) {
                    order.add(id);
                    done.add(id);
                    for (String c : children.getOrDefault(id, List.of())) {
                        inDegree.merge(c, -1, Integer::sum);
                    }
                    progressed = true;
                    break;
                }
            }
        }
        if (order.size() != defs.size()) {
            List<String> cyclic = defs.keySet().stream().filter(id -> !done.contains(id)).collect(Collectors.toList());
            throw new ProvenanceCycleException(cyclic);
        }
        return order;
    }

    private static String singleTerminal(Map<String, StepDefinition> defs) {
        Set<String> referenced = new HashSet<>();
        defs.values().forEach(s -> referenced.addAll(parentsOf(s)));
        List<String> terminals = defs.keySet().stream().filter(id -> !referenced.contains(id)).toList();
        if (terminals.size() != 1) {
            throw new ProvenanceException("Expected exactly one terminal step, found " + terminals);
        }
        return terminals.get(0);
    }

    private CalculationStep evaluate(RunContext ctx, StepDefinition def, Map<String, CalculationStep> done,
                                     MasterDocumentIndex masters) {
        CalculationStep step = new CalculationStep();
        step.setStepId(def.getId());
        step.setKind(def.getKind());
        step.setDescription(def.getDescription());
        step.setParentStepIds(new ArrayList<>(parentsOf(def)));
        switch (def.getKind()) {
            case SOURCE -> resolveSource(ctx, def, step, masters);
            case FORMULA -> {
                List<BigDecimal> args = parentValues(def, done);
                step.setFormula(def.getFormula() + "(" + String.join(", ", parentsOf(def))
                        + (def.getFactor() != null ? "; " + def.getFactor().toPlainString() : "") + ")");
                step.setValue(args == null ? null : def.getFormula().apply(args, def.getFactor()));
            }
            case ADJUSTMENT -> {
                List<BigDecimal> args = parentValues(def, done);
                step.setFormula(parentsOf(def).get(0) + " × " + def.getFactor().toPlainString());
                step.setRationale(def.getRationale());
                step.setValue(args == null ? null : args.get(0).multiply(def.getFactor()));
            }
        }
        return step;
    }

    /** Null when any parent value is missing. */
    private static List<BigDecimal> parentValues(StepDefinition def, Map<String, CalculationStep> done) {
        List<BigDecimal> out = new ArrayList<>();
        for (String p : parentsOf(def)) {
            BigDecimal v = done.get(p).getValue();
            if (v == null) {
                return null;
            }
            out.add(v);
        }
        return out;
    }

    private static void resolveSource(RunContext ctx, StepDefinition def, CalculationStep step, MasterDocumentIndex masters) {
        if (def.getAttribute() != null) {
            ReconciledAttribute a = ctx.getAttributes().get(def.getAttribute());
            if (a == null) {
                throw new MissingReferenceException("Step " + def.getId() + " references unknown attribute " + def.getAttribute());
            }
            if (!a.hasValue()) {
                return;
            }
            checkDocumentReference(ctx, def, a.getSourceDocumentId(), a.getSourcePage());
            step.setDocumentId(a.getSourceDocumentId());
            step.setPage(a.getSourcePage());
            step.setValue(a.getValue().asNumber().orElse(null));
            return;
        }
        if (def.getInstrumentType() == null || def.getFieldKey() == null) {
            throw new ProvenanceException("SOURCE step " + def.getId() + " needs an attribute or instrumentType + fieldKey");
        }
        String masterId = masters.masterFor(def.getInstrumentType()).orElse(null);
        if (masterId == null) {
            return;
        }
        DocumentClassification c = ctx.getClassifications().get(masterId);
        ExtractedField f = c == null ? null : c.field(def.getFieldKey()).filter(ExtractedField::hasValue).orElse(null);
        if (f == null) {
            return;
        }
        checkDocumentReference(ctx, def, masterId, f.getPage());
        step.setDocumentId(masterId);
        step.setPage(f.getPage());
        step.setValue(f.getValue().asNumber().orElse(null));
    }

    private static void checkDocumentReference(RunContext ctx, StepDefinition def, String documentId, Integer page) {
        LoanDocument d = ctx.document(documentId);
        if (d == null) {
            throw new MissingReferenceException("Step " + def.getId() + " cites unknown document " + documentId);
        }
        if (page != null && !d.hasPage(page)) {
            throw new MissingReferenceException("Step " + def.getId() + " cites page " + page + " of document "
                    + documentId + " which has " + d.getPageCount() + " pages");
        }
    }

    private static BigDecimal expectedValue(RunContext ctx, CalculationRecipe recipe) {
        ReconciledAttribute a = ctx.getAttributes().get(recipe.effectiveExpectedAttribute());
        if (a == null || !a.hasValue()) {
            return null;
        }
        return a.getValue().asNumber().orElse(null);
    }

    private static List<String> parentsOf(StepDefinition s) {
        return s.getParents() == null ? List.of() : s.getParents();
    }
}
