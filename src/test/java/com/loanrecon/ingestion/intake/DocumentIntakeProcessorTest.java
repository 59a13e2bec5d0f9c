package com.loanrecon.ingestion.intake;

import com.loanrecon.LoanFixtures;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentFingerprint;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.ingestion.config.IntakeProperties;
import com.loanrecon.ingestion.content.DocumentContent;
import com.loanrecon.ingestion.content.DocumentContentStore;
import com.loanrecon.ingestion.identity.ContentFingerprinter;
import com.loanrecon.ingestion.oracle.ClassificationOracle;
import com.loanrecon.ingestion.oracle.OracleJudgment;
import com.loanrecon.ingestion.oracle.TransientOracleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentIntakeProcessorTest {

    private static final String APPLICATION_TEXT =
            "Uniform Residential Loan Application. Borrower: Jane Sample. Loan amount: $412,500. Term 360 months.";
    private static final String APPRAISAL_TEXT =
            "Uniform Residential Appraisal Report. Subject property 12 Elm Street. Opinion of market value $515,000.";

    @Mock
    DocumentContentStore documentContentStore;
    @Mock
    ClassificationOracle classificationOracle;

    private DocumentIntakeProcessor processor;

    private final LoanDocument d1 = LoanFixtures.document("d1", 4);
    private final LoanDocument d2 = LoanFixtures.document("d2", 4);
    private final LoanDocument d3 = LoanFixtures.document("d3", 2);
    private final LoanDocument d4 = LoanFixtures.document("d4", 30);

    @BeforeEach
    void setUp() {
        IntakeProperties props = new IntakeProperties();
        processor = new DocumentIntakeProcessor(documentContentStore, new ContentFingerprinter(props),
                classificationOracle, props, Runnable::run);
    }

    @Test
    @DisplayName("duplicates, unfingerprintable documents and oracle failures degrade only those documents")
    void degradesPerDocument() {
        when(documentContentStore.load(d1)).thenReturn(Optional.of(new DocumentContent(APPLICATION_TEXT, null)));
        when(documentContentStore.load(d2)).thenReturn(Optional.of(new DocumentContent(APPLICATION_TEXT + "  ", null)));
        when(documentContentStore.load(d3)).thenReturn(Optional.empty());
        when(documentContentStore.load(d4)).thenReturn(Optional.of(new DocumentContent(APPRAISAL_TEXT, null)));
        when(classificationOracle.classify(eq(d1), any())).thenReturn(judgment("application_form"));
        when(classificationOracle.classify(eq(d4), any())).thenThrow(new TransientOracleException("retries exhausted"));

        RunContext ctx = new RunContext(LoanFixtures.LOAN_ID, "exec-1", List.of(d4, d3, d2, d1));
        IntakeResult result = processor.process(ctx, Map.of());

        assertThat(result.fingerprints().get("d1").getStatus()).isEqualTo(DocumentFingerprint.FingerprintStatus.FINGERPRINTED);
        assertThat(result.fingerprints().get("d2").getStatus()).isEqualTo(DocumentFingerprint.FingerprintStatus.EXACT_DUPLICATE);
        assertThat(result.fingerprints().get("d2").getDuplicateOfDocumentId()).isEqualTo("d1");
        assertThat(result.fingerprints().get("d3").getStatus()).isEqualTo(DocumentFingerprint.FingerprintStatus.UNFINGERPRINTABLE);

        assertThat(result.classifications()).containsOnlyKeys("d1", "d4");
        assertThat(result.classifications().get("d1").getTypeLabel()).isEqualTo("application_form");
        assertThat(result.classifications().get("d4").getStatus())
                .isEqualTo(DocumentClassification.ClassificationStatus.NEEDS_REVIEW);
        assertThat(result.needsReviewCount()).isEqualTo(1);
        verify(classificationOracle, never()).classify(eq(d2), any());

        assertThat(ctx.issuesSnapshot())
                .extracting(RunIssue::getKind, RunIssue::getDocumentId)
                .containsExactlyInAnyOrder(
                        tuple(RunIssue.Kind.FINGERPRINT_FAILURE, "d3"),
                        tuple(RunIssue.Kind.ORACLE_FAILURE, "d4"));
    }

    @Test
    @DisplayName("unchanged content reuses the previous classification instead of calling the oracle")
    void reusesClassificationForUnchangedContent() {
        when(documentContentStore.load(d1)).thenReturn(Optional.of(new DocumentContent(APPLICATION_TEXT, null)));
        when(classificationOracle.classify(eq(d1), any())).thenReturn(judgment("application_form"));

        IntakeResult first = processor.process(new RunContext(LoanFixtures.LOAN_ID, "exec-1", List.of(d1)), Map.of());
        IntakeResult second = processor.process(new RunContext(LoanFixtures.LOAN_ID, "exec-2", List.of(d1)),
                first.classifications());

        verify(classificationOracle, times(1)).classify(eq(d1), any());
        assertThat(second.classifications().get("d1").getTypeLabel()).isEqualTo("application_form");
        assertThat(second.classifications().get("d1").getExecutionId()).isEqualTo("exec-2");
    }

    private static OracleJudgment judgment(String type) {
        return new OracleJudgment(type, null, FinalityIndicator.FINAL, true, null, Map.of());
    }
}
