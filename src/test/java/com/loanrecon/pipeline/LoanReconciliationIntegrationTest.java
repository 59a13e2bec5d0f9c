package com.loanrecon.pipeline;

import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.CalculationTraceRepository;
import com.loanrecon.domain.ComplianceResult;
import com.loanrecon.domain.ComplianceRun;
import com.loanrecon.domain.ComplianceStatus;
import com.loanrecon.domain.ExtractedField;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.Loan;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.LoanDocumentRepository;
import com.loanrecon.domain.LoanRepository;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciledAttributeRepository;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.ingestion.content.DocumentContent;
import com.loanrecon.ingestion.content.DocumentContentStore;
import com.loanrecon.ingestion.oracle.ClassificationOracle;
import com.loanrecon.ingestion.oracle.OracleJudgment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@SpringBootTest
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class LoanReconciliationIntegrationTest {

    private static final String LOAN_ID = "loan-it";

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    LoanRepository loanRepository;
    @Autowired
    LoanDocumentRepository loanDocumentRepository;
    @Autowired
    ReconciledAttributeRepository reconciledAttributeRepository;
    @Autowired
    CalculationTraceRepository calculationTraceRepository;
    @Autowired
    ReconciliationRunService reconciliationRunService;
    @Autowired
    LoanRecordService loanRecordService;

    @MockBean
    ClassificationOracle classificationOracle;
    @MockBean
    DocumentContentStore documentContentStore;

    @Test
    @DisplayName("reconciliation picks the final transmittal, verifies averaged income and feeds compliance")
    void endToEnd() {
        loanRepository.save(loan());
        loanDocumentRepository.saveAll(List.of(
                document("tsum-draft", 3), document("tsum-final", 3), document("w2", 2), document("appraisal", 12)));
        when(documentContentStore.load(any(LoanDocument.class))).thenAnswer(inv -> {
            LoanDocument d = inv.getArgument(0);
            return Optional.of(new DocumentContent("Content of " + d.getId() + " for loan " + d.getLoanId()
                    + " with enough characters to be hashed as text", null));
        });
        Map<String, OracleJudgment> judgments = Map.of(
                "tsum-draft", new OracleJudgment("transmittal_summary", "1008", FinalityIndicator.INITIAL, false, null, Map.of(
                        "loan_amount", field("390000", 1),
                        "total_monthly_income", field("21000", 2))),
                "tsum-final", new OracleJudgment("transmittal_summary", "1008", FinalityIndicator.FINAL, true, null, Map.of(
                        "loan_amount", field("400000", 1),
                        "total_monthly_income", field("21759.79", 2),
                        "total_monthly_debt", field("8000", 2))),
                "w2", new OracleJudgment("w2", null, FinalityIndicator.FINAL, null, null, Map.of(
                        "wages_current_year", field("270000", 1),
                        "wages_prior_year", field("252234", 2))),
                "appraisal", new OracleJudgment("appraisal", null, FinalityIndicator.FINAL, true, null, Map.of(
                        "appraised_value", field("500000", 3))));
        when(classificationOracle.classify(any(LoanDocument.class), any(DocumentContent.class)))
                .thenAnswer(inv -> judgments.get(((LoanDocument) inv.getArgument(0)).getId()));

        ReconciliationRun run = reconciliationRunService.runNow(LOAN_ID, "exec-it", ReconciliationRun.Trigger.DIRECT);

        assertThat(run.getStatus()).isEqualTo(ReconciliationRun.RunStatus.PARTIAL);
        assertThat(run.hasOracleFailures()).isFalse();
        assertThat(run.getDocumentCount()).isEqualTo(4);
        assertThat(run.getGroupCount()).isEqualTo(3);

        Map<String, ReconciledAttribute> attributes = reconciledAttributeRepository.findByLoanIdOrderByNameAsc(LOAN_ID)
                .stream().collect(Collectors.toMap(ReconciledAttribute::getName, Function.identity()));
        assertThat(attributes.get("loan_amount").getSourceDocumentId()).isEqualTo("tsum-final");
        assertThat(attributes.get("loan_amount").getValue().asNumber())
                .hasValueSatisfying(n -> assertThat(n).isEqualByComparingTo("400000"));
        assertThat(attributes.get("property_value").getSourceDocumentId()).isEqualTo("appraisal");
        assertThat(attributes.get("apr").isUnsourced()).isTrue();

        CalculationTrace income = calculationTraceRepository
                .findByLoanIdAndAttributeName(LOAN_ID, "qualifying_monthly_income").orElseThrow();
        assertThat(income.getStatus()).isEqualTo(VerificationStatus.MATCH);
        assertThat(income.getCalculatedValue()).isEqualByComparingTo("21759.75");

        ComplianceRun compliance = loanRecordService.getLatestComplianceRun(LOAN_ID).orElseThrow();
        assertThat(compliance.getReconciliationExecutionId()).isEqualTo("exec-it");
        Map<String, ComplianceStatus> byRule = loanRecordService.getComplianceResults(LOAN_ID).stream()
                .collect(Collectors.toMap(ComplianceResult::getRuleCode, ComplianceResult::getStatus));
        assertThat(byRule).hasSize(11)
                .containsEntry("ATR-INC-001", ComplianceStatus.PASS)
                .containsEntry("ATR-DTI-001", ComplianceStatus.PASS)
                .containsEntry("INV-LTV-001", ComplianceStatus.PASS)
                .containsEntry("STATE-TX-001", ComplianceStatus.NA)
                .containsEntry("TILA-APR-001", ComplianceStatus.ERROR)
                .containsEntry("RESPA-AFBA-001", ComplianceStatus.PENDING_REVIEW);

        webTestClient.get()
                .uri("/api/v1/loans/" + LOAN_ID + "/attributes/qualifying_monthly_income/trace")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("MATCH")
                .jsonPath("$.steps.length()").isEqualTo(5)
                .jsonPath("$.steps[3].rationale").isEqualTo("2-year income averaging");
    }

    private static Loan loan() {
        Loan loan = new Loan();
        loan.setId(LOAN_ID);
        loan.setLoanNumber("LN-IT-1");
        loan.setLoanType("CONVENTIONAL");
        loan.setPropertyState("CA");
        loan.setApplicationDate(LocalDate.of(2024, 3, 1));
        return loan;
    }

    private static LoanDocument document(String id, int pages) {
        LoanDocument d = new LoanDocument();
        d.setId(id);
        d.setLoanId(LOAN_ID);
        d.setFileName(id + ".pdf");
        d.setPageCount(pages);
        d.setStorageKey(id);
        return d;
    }

    private static ExtractedField field(String amount, int page) {
        return new ExtractedField(FieldValue.number(new BigDecimal(amount)), page);
    }
}
