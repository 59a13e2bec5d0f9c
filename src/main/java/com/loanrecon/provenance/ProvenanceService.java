package com.loanrecon.provenance;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.provenance.config.ProvenanceProperties;
import com.loanrecon.provenance.config.ProvenanceProperties.CalculationRecipe;
import com.loanrecon.reconciliation.MasterDocumentIndex;
import com.loanrecon.versioning.VersionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a verified calculation trace for every configured recipe. One attribute's failure never affects another's.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProvenanceService {

    private final ProvenanceProperties provenanceProperties;
    private final CalculationGraphBuilder calculationGraphBuilder;
    private final VersionResolver versionResolver;

    public Map<String, CalculationTrace> buildAll(RunContext ctx) {
        MasterDocumentIndex masters = MasterDocumentIndex.build(ctx, versionResolver);
        Map<String, CalculationTrace> traces = new LinkedHashMap<>();
        for (CalculationRecipe recipe : provenanceProperties.getCalculations()) {
            CalculationTrace t = calculationGraphBuilder.build(ctx, recipe, masters);
            traces.put(recipe.getAttribute(), t);
            if (t.getStatus() == VerificationStatus.VERIFICATION_ERROR) {
                ctx.addIssue(RunIssue.forAttribute(RunIssue.Kind.VERIFICATION_ERROR, recipe.getAttribute(), null, null,
                        t.getErrorMessage()));
                log.warn("Calculation trace for {} of loan {} is invalid: {}", recipe.getAttribute(), ctx.getLoanId(),
                        t.getErrorMessage());
            } else if (t.getStatus() == VerificationStatus.MISSING_INPUT) {
                ctx.addIssue(RunIssue.forAttribute(RunIssue.Kind.MISSING_INPUT, recipe.getAttribute(), null, null,
                        t.getErrorMessage()));
            } else if (t.getStatus() == VerificationStatus.MISMATCH) {
                log.info("Attribute {} of loan {}: calculated {} vs stated {} ({}%)", recipe.getAttribute(),
                        ctx.getLoanId(), t.getCalculatedValue(), t.getExpectedValue(), t.getVariancePct());
            }
        }
        log.info("Built {} calculation traces for loan {} run {}", traces.size(), ctx.getLoanId(), ctx.getExecutionId());
        return traces;
    }
}
