package com.loanrecon.pipeline;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.CalculationTraceRepository;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentClassificationRepository;
import com.loanrecon.domain.DocumentFingerprintRepository;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.InstrumentGroup;
import com.loanrecon.domain.InstrumentGroupRepository;
import com.loanrecon.domain.LoanDocumentRepository;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ManualAttributeValueRepository;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciledAttributeRepository;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.ReconciliationRunRepository;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.ingestion.intake.DocumentIntakeProcessor;
import com.loanrecon.ingestion.intake.IntakeResult;
import com.loanrecon.provenance.ProvenanceService;
import com.loanrecon.reconciliation.AttributeReconciler;
import com.loanrecon.versioning.InstrumentGroupingService;
import com.loanrecon.versioning.VersionResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.loanrecon.LoanFixtures.LOAN_ID;
import static com.loanrecon.LoanFixtures.byDocument;
import static com.loanrecon.LoanFixtures.classification;
import static com.loanrecon.LoanFixtures.document;
import static com.loanrecon.LoanFixtures.fingerprint;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationPipelineTest {

    @Mock
    private LoanRepository loanRepository;
    @Mock
    private LoanDocumentRepository loanDocumentRepository;
    @Mock
    private DocumentFingerprintRepository documentFingerprintRepository;
    @Mock
    private DocumentClassificationRepository documentClassificationRepository;
    @Mock
    private InstrumentGroupRepository instrumentGroupRepository;
    @Mock
    private ReconciledAttributeRepository reconciledAttributeRepository;
    @Mock
    private CalculationTraceRepository calculationTraceRepository;
    @Mock
    private ManualAttributeValueRepository manualAttributeValueRepository;
    @Mock
    private ReconciliationRunRepository reconciliationRunRepository;
    @Mock
    private DocumentIntakeProcessor documentIntakeProcessor;
    @Mock
    private InstrumentGroupingService instrumentGroupingService;
    @Mock
    private VersionResolver versionResolver;
    @Mock
    private AttributeReconciler attributeReconciler;
    @Mock
    private ProvenanceService provenanceService;

    @InjectMocks
    private ReconciliationPipeline pipeline;

    @Test
    @DisplayName("a run without issues is COMPLETE and replaces the loan's stored outputs")
    void run_complete() {
        stubStages();
        when(documentIntakeProcessor.process(any(RunContext.class), anyMap())).thenReturn(intake());

        ReconciliationRun run = pipeline.run(LOAN_ID, "exec-1", ReconciliationRun.Trigger.API, 0);

        assertThat(run.getStatus()).isEqualTo(ReconciliationRun.RunStatus.COMPLETE);
        assertThat(run.getExecutionId()).isEqualTo("exec-1");
        assertThat(run.getDocumentCount()).isEqualTo(1);
        assertThat(run.getGroupCount()).isEqualTo(1);
        assertThat(run.getAttributeCount()).isEqualTo(1);
        assertThat(run.getCompletedAt()).isNotNull();
        verify(reconciledAttributeRepository).deleteByLoanId(LOAN_ID);
        verify(reconciledAttributeRepository).saveAll(anyCollection());
        verify(calculationTraceRepository).deleteByLoanId(LOAN_ID);
        verify(instrumentGroupRepository).saveAll(anyList());
        verify(reconciliationRunRepository, times(2)).save(run);
    }

    @Test
    void run_withIssues_isPartial() {
        stubStages();
        doAnswer(inv -> {
            RunContext ctx = inv.getArgument(0);
            ctx.addIssue(RunIssue.forDocument(RunIssue.Kind.ORACLE_FAILURE, "d1", "oracle unavailable"));
            return intake();
        }).when(documentIntakeProcessor).process(any(RunContext.class), anyMap());

        ReconciliationRun run = pipeline.run(LOAN_ID, "exec-1", ReconciliationRun.Trigger.API, 0);

        assertThat(run.getStatus()).isEqualTo(ReconciliationRun.RunStatus.PARTIAL);
        assertThat(run.hasOracleFailures()).isTrue();
        assertThat(run.getVerificationErrorCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("a stage failure marks the run FAILED and keeps the previous outputs")
    void run_stageFailure_isFailed() {
        when(loanRepository.existsById(LOAN_ID)).thenReturn(true);
        when(loanDocumentRepository.findByLoanIdOrderByIdAsc(LOAN_ID)).thenReturn(List.of(document("d1", 10)));
        when(documentClassificationRepository.findByLoanId(LOAN_ID)).thenReturn(List.of());
        when(documentIntakeProcessor.process(any(RunContext.class), anyMap())).thenReturn(intake());
        when(instrumentGroupingService.group(any(RunContext.class))).thenThrow(new IllegalStateException("boom"));

        ReconciliationRun run = pipeline.run(LOAN_ID, "exec-1", ReconciliationRun.Trigger.API, 0);

        assertThat(run.getStatus()).isEqualTo(ReconciliationRun.RunStatus.FAILED);
        assertThat(run.getErrorMessage()).isEqualTo("IllegalStateException: boom");
        verify(reconciledAttributeRepository, never()).deleteByLoanId(anyString());
        verify(documentFingerprintRepository, never()).deleteByLoanId(anyString());
    }

    @Test
    void run_unknownLoan() {
        when(loanRepository.existsById("nope")).thenReturn(false);

        assertThatThrownBy(() -> pipeline.run("nope", "exec-1", ReconciliationRun.Trigger.API, 0))
                .isInstanceOf(LoanNotFoundException.class);
        verify(reconciliationRunRepository, never()).save(any());
    }

    private void stubStages() {
        when(loanRepository.existsById(LOAN_ID)).thenReturn(true);
        when(loanDocumentRepository.findByLoanIdOrderByIdAsc(LOAN_ID)).thenReturn(List.of(document("d1", 10)));
        when(documentClassificationRepository.findByLoanId(LOAN_ID)).thenReturn(List.of());
        InstrumentGroup group = new InstrumentGroup();
        group.setId(LOAN_ID + ":fp:note:d1");
        group.setLoanId(LOAN_ID);
        group.setInstrumentType("note");
        group.setMemberDocumentIds(List.of("d1"));
        when(instrumentGroupingService.group(any(RunContext.class))).thenReturn(List.of(group));
        when(versionResolver.resolveAll(any(RunContext.class), anyList())).thenReturn(List.of(group));
        when(manualAttributeValueRepository.findByLoanId(LOAN_ID)).thenReturn(List.of());
        ReconciledAttribute amount = ReconciledAttribute.unsourced(LOAN_ID, "exec-1", "loan_amount", "USD");
        amount.setUnsourced(false);
        when(attributeReconciler.reconcile(any(RunContext.class), anyList())).thenReturn(Map.of("loan_amount", amount));
        CalculationTrace trace = new CalculationTrace();
        trace.setAttributeName("qualifying_monthly_income");
        trace.setStatus(VerificationStatus.VERIFICATION_ERROR);
        when(provenanceService.buildAll(any(RunContext.class))).thenReturn(Map.of("qualifying_monthly_income", trace));
    }

    private static IntakeResult intake() {
        DocumentClassification note = classification("d1", "note", null, FinalityIndicator.FINAL, true, null);
        return new IntakeResult(byDocument(fingerprint("d1", "hash-d1", null)), byDocument(note));
    }
}
