package com.loanrecon.api.controller;

import com.loanrecon.api.dto.AttributeResponse;
import com.loanrecon.api.dto.CalculationTraceResponse;
import com.loanrecon.api.dto.ComplianceReportResponse;
import com.loanrecon.api.dto.ErrorBody;
import com.loanrecon.api.dto.ManualAttributeRequest;
import com.loanrecon.api.dto.ReconciliationRunResponse;
import com.loanrecon.api.dto.RunAcceptedResponse;
import com.loanrecon.domain.CalculationTrace;
import com.loanrecon.domain.ComplianceResult;
import com.loanrecon.domain.ComplianceRun;
import com.loanrecon.domain.FieldValue;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.ReconciliationRun;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.ingestion.oracle.OracleResponseParser;
import com.loanrecon.pipeline.LoanRecordService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciled record of one loan: attributes with citations, calculation traces, compliance results,
 * re-run triggers and manual fallback entries.
 */
@RestController
@RequestMapping("/api/v1/loans/{loanId}")
@RequiredArgsConstructor
public class LoanRecordController {

    private final LoanRecordService loanRecordService;
    private final OracleResponseParser oracleResponseParser;

    @GetMapping("/attributes")
    public ResponseEntity<List<AttributeResponse>> getAttributes(@PathVariable String loanId) {
        return ResponseEntity.ok(loanRecordService.getReconciledAttributes(loanId).stream()
                .map(LoanRecordController::toResponse)
                .toList());
    }

    @GetMapping("/attributes/{name}/trace")
    public ResponseEntity<?> getTrace(@PathVariable String loanId, @PathVariable String name) {
        Optional<CalculationTrace> trace = loanRecordService.getCalculationTrace(loanId, name);
        if (trace.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("TRACE_NOT_FOUND", "No calculation trace for attribute " + name));
        }
        return ResponseEntity.ok(toResponse(trace.get()));
    }

    @GetMapping("/compliance")
    public ResponseEntity<?> getCompliance(@PathVariable String loanId) {
        Optional<ComplianceRun> run = loanRecordService.getLatestComplianceRun(loanId);
        if (run.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("COMPLIANCE_NOT_RUN", "Compliance has not been evaluated for loan " + loanId));
        }
        List<ComplianceResult> results = loanRecordService.getComplianceResults(loanId);
        return ResponseEntity.ok(toResponse(run.get(), results));
    }

    @PostMapping("/reconciliation")
    public ResponseEntity<RunAcceptedResponse> reRunReconciliation(@PathVariable String loanId) {
        String executionId = loanRecordService.reRunReconciliation(loanId);
        return ResponseEntity.accepted().body(new RunAcceptedResponse(executionId, "Reconciliation triggered"));
    }

    @GetMapping("/reconciliation/latest")
    public ResponseEntity<?> latestReconciliation(@PathVariable String loanId) {
        Optional<ReconciliationRun> run = loanRecordService.getLatestReconciliationRun(loanId);
        if (run.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorBody.of("RECONCILIATION_NOT_RUN", "Loan " + loanId + " has not been reconciled"));
        }
        return ResponseEntity.ok(toResponse(run.get()));
    }

    @PostMapping("/compliance")
    public ResponseEntity<RunAcceptedResponse> reRunCompliance(@PathVariable String loanId) {
        loanRecordService.reRunCompliance(loanId);
        return ResponseEntity.accepted().body(new RunAcceptedResponse(null, "Compliance run triggered"));
    }

    @PostMapping("/manual-attributes")
    public ResponseEntity<?> addManualAttribute(@PathVariable String loanId,
                                                @RequestBody @Valid ManualAttributeRequest request) {
        FieldValue value = oracleResponseParser.coerce(request.value());
        if (value.isMissing()) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_VALUE", "value does not carry a usable value"));
        }
        loanRecordService.addManualAttribute(loanId, request.attributeName().trim(), value,
                request.documentId().trim(), request.page(), request.enteredBy().trim(), request.note());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RunAcceptedResponse(null, "Manual value stored; applies from the next reconciliation"));
    }

    private static AttributeResponse toResponse(ReconciledAttribute a) {
        FieldValue value = a.getValue() == null ? FieldValue.missing() : a.getValue();
        return new AttributeResponse(
                a.getName(),
                value.display(),
                value.getKind().name(),
                a.getUnit(),
                a.getSourceDocumentId(),
                a.getSourcePage(),
                a.getSourceTier() == null ? null : a.getSourceTier().name(),
                a.getSourceInstrumentType(),
                a.isUnsourced(),
                a.getExecutionId()
        );
    }

    private static CalculationTraceResponse toResponse(CalculationTrace t) {
        return new CalculationTraceResponse(
                t.getAttributeName(),
                t.getStatus() == null ? null : t.getStatus().name(),
                t.getCalculatedValue(),
                t.getExpectedValue(),
                t.getAbsoluteDifference(),
                t.getVariancePct(),
                t.getTerminalStepId(),
                t.getErrorMessage(),
                t.getSteps().stream()
                        .map(s -> new CalculationTraceResponse.Step(
                                s.getStepId(),
                                s.getOrder(),
                                s.getKind().name(),
                                s.getDescription(),
                                s.getValue(),
                                s.getDocumentId(),
                                s.getPage(),
                                s.getFormula(),
                                s.getRationale(),
                                s.getParentStepIds()
                        ))
                        .toList()
        );
    }

    private static ComplianceReportResponse toResponse(ComplianceRun run, List<ComplianceResult> results) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        run.getCounts().forEach((status, n) -> counts.put(status.name(), n));
        return new ComplianceReportResponse(
                run.getExecutionId(),
                run.getReconciliationExecutionId(),
                run.getOverallStatus() == null ? null : run.getOverallStatus().name(),
                counts,
                run.getCompletedAt(),
                results.stream()
                        .map(r -> new ComplianceReportResponse.Result(
                                r.getRuleCode(),
                                r.getRuleName(),
                                r.getCategory() == null ? null : r.getCategory().name(),
                                r.getSeverity() == null ? null : r.getSeverity().name(),
                                r.getStatus().name(),
                                r.getMessage(),
                                r.getExpectedValue(),
                                r.getActualValue(),
                                r.getVariance(),
                                r.isRequiresManualReview(),
                                r.getRemediationGuidance(),
                                r.getEvidence()
                        ))
                        .toList()
        );
    }

    private static ReconciliationRunResponse toResponse(ReconciliationRun run) {
        return new ReconciliationRunResponse(
                run.getExecutionId(),
                run.getStatus().name(),
                run.getTrigger() == null ? null : run.getTrigger().name(),
                run.getRetryCount(),
                run.getDocumentCount(),
                run.getDuplicateCount(),
                run.getNeedsReviewCount(),
                run.getGroupCount(),
                run.getAttributeCount(),
                run.getUnsourcedCount(),
                run.getVerificationErrorCount(),
                run.getIssues().stream().map(RunIssue::toString).toList(),
                run.getErrorMessage(),
                run.getStartedAt(),
                run.getCompletedAt()
        );
    }
}
