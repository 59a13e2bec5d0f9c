package com.loanrecon.provenance;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.provenance.config.ProvenanceProperties;
import com.loanrecon.provenance.config.ProvenanceProperties.CalculationRecipe;
import com.loanrecon.versioning.VersionResolver;
import com.loanrecon.versioning.config.VersioningProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.loanrecon.LoanFixtures.classification;
import static com.loanrecon.LoanFixtures.resolvedContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProvenanceServiceTest {

    @Mock
    private CalculationGraphBuilder calculationGraphBuilder;

    @Test
    void recordsOneTracePerRecipeAndRaisesIssuesForBrokenOnes() {
        CalculationRecipe income = recipe("qualifying_monthly_income");
        CalculationRecipe housing = recipe("total_housing_payment");
        CalculationRecipe reserves = recipe("reserves");
        ProvenanceProperties properties = new ProvenanceProperties();
        properties.setCalculations(List.of(income, housing, reserves));

        when(calculationGraphBuilder.build(any(RunContext.class), eq(income), any()))
                .thenReturn(trace("qualifying_monthly_income", VerificationStatus.MATCH, null));
        when(calculationGraphBuilder.build(any(RunContext.class), eq(housing), any()))
                .thenReturn(trace("total_housing_payment", VerificationStatus.VERIFICATION_ERROR, "cycle through a"));
        when(calculationGraphBuilder.build(any(RunContext.class), eq(reserves), any()))
                .thenReturn(trace("reserves", VerificationStatus.MISSING_INPUT, "no value for assets"));

        RunContext ctx = resolvedContext(classification("tsum", "transmittal_summary", null, FinalityIndicator.FINAL, true, null));
        ProvenanceService service = new ProvenanceService(properties, calculationGraphBuilder,
                new VersionResolver(new VersioningProperties()));

        Map<String, CalculationTrace> traces = service.buildAll(ctx);

        assertThat(traces).containsOnlyKeys("qualifying_monthly_income", "total_housing_payment", "reserves");
        assertThat(ctx.issuesSnapshot())
                .extracting(RunIssue::getKind, RunIssue::getAttributeName)
                .containsExactlyInAnyOrder(
                        tuple(RunIssue.Kind.VERIFICATION_ERROR, "total_housing_payment"),
                        tuple(RunIssue.Kind.MISSING_INPUT, "reserves"));
    }

    private static CalculationRecipe recipe(String attribute) {
        CalculationRecipe r = new CalculationRecipe();
        r.setAttribute(attribute);
        return r;
    }

    private static CalculationTrace trace(String attribute, VerificationStatus status, String error) {
        CalculationTrace t = new CalculationTrace();
        t.setAttributeName(attribute);
        t.setStatus(status);
        t.setErrorMessage(error);
        return t;
    }
}
