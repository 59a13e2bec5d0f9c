package com.loanrecon.ingestion.intake;

import com.loanrecon.config.AsyncConfig;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentFingerprint;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.ingestion.config.IntakeProperties;
import com.loanrecon.ingestion.content.DocumentContent;
import com.loanrecon.ingestion.content.DocumentContentStore;
import com.loanrecon.ingestion.identity.ContentFingerprinter;
import com.loanrecon.ingestion.identity.Fingerprint;
import com.loanrecon.ingestion.identity.FingerprintException;
import com.loanrecon.ingestion.oracle.ClassificationOracle;
import com.loanrecon.ingestion.oracle.OracleException;
import com.loanrecon.ingestion.oracle.OracleJudgment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Document intake for one run, in two parallel phases on intake-executor:
 * <ol>
 *   <li>fingerprint every document, then (after the barrier) mark exact duplicates, lowest id canonical;</li>
 *   <li>classify each canonical fingerprinted document through the oracle, reusing a previous CLASSIFIED
 *       judgment when the exact hash is unchanged.</li>
 * </ol>
 * Per-document failures degrade that document only and are recorded as {@link RunIssue}s.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentIntakeProcessor {

    private final DocumentContentStore documentContentStore;
    private final ContentFingerprinter contentFingerprinter;
    private final ClassificationOracle classificationOracle;
    private final IntakeProperties intakeProperties;
    @Qualifier(AsyncConfig.INTAKE_EXECUTOR)
    private final Executor intakeExecutor;

    /**
     * @param previous classifications from the last run keyed by document id (may be empty)
     */
    public IntakeResult process(RunContext ctx, Map<String, DocumentClassification> previous) {
        List<LoanDocument> documents = new ArrayList<>(ctx.getDocuments().values());
        Map<String, DocumentContent> contents = new ConcurrentHashMap<>();
        Map<String, DocumentFingerprint> fingerprints = new TreeMap<>(
                runParallel(documents, d -> fingerprintOne(ctx, d, contents)));
        markDuplicates(fingerprints);

        List<LoanDocument> toClassify = documents.stream()
                .filter(d -> fingerprints.get(d.getId()).isUsableForGrouping())
                .toList();
        Map<String, DocumentClassification> prior = previous != null ? previous : Map.of();
        Map<String, DocumentClassification> classifications = new TreeMap<>(
                runParallel(toClassify, d -> classifyOne(ctx, d, fingerprints.get(d.getId()), contents, prior)));

        IntakeResult result = new IntakeResult(fingerprints, classifications);
        log.info("Intake for loan {} run {}: {} documents, {} duplicates, {} unfingerprintable, {} need review",
                ctx.getLoanId(), ctx.getExecutionId(), documents.size(),
                result.count(DocumentFingerprint.FingerprintStatus.EXACT_DUPLICATE),
                result.count(DocumentFingerprint.FingerprintStatus.UNFINGERPRINTABLE),
                result.needsReviewCount());
        return result;
    }

    private <T> Map<String, T> runParallel(List<LoanDocument> documents, Function<LoanDocument, T> task) {
        if (documents.isEmpty()) {
            return Map.of();
        }
        int workers = Math.max(1, Math.min(intakeProperties.getConcurrency(), documents.size()));
        Semaphore semaphore = new Semaphore(workers);
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        for (LoanDocument d : documents) {
            futures.put(d.getId(), CompletableFuture.supplyAsync(() -> withPermit(semaphore, () -> task.apply(d)), intakeExecutor));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        Map<String, T> out = new HashMap<>();
        futures.forEach((id, f) -> out.put(id, f.join()));
        return out;
    }

    private static <T> T withPermit(Semaphore semaphore, Supplier<T> work) {
        boolean acquired = false;
        try {
            semaphore.acquire();
            acquired = true;
            return work.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for intake permit", e);
        } finally {
            if (acquired) {
                semaphore.release();
            }
        }
    }

    private DocumentFingerprint fingerprintOne(RunContext ctx, LoanDocument document, Map<String, DocumentContent> contents) {
        DocumentFingerprint fp = new DocumentFingerprint();
        fp.setId(ctx.getLoanId() + ":" + document.getId());
        fp.setLoanId(ctx.getLoanId());
        fp.setDocumentId(document.getId());
        fp.setExecutionId(ctx.getExecutionId());
        fp.setComputedAt(Instant.now());
        try {
            DocumentContent content = documentContentStore.load(document)
                    .orElseThrow(() -> new FingerprintException("No content stored for document " + document.getId()));
            Fingerprint f = contentFingerprinter.fingerprint(document, content);
            fp.setExactHash(f.exactHash());
            fp.setPerceptualHash(f.perceptualHash());
            fp.setStatus(DocumentFingerprint.FingerprintStatus.FINGERPRINTED);
            contents.put(document.getId(), content);
        } catch (RuntimeException e) {
            fp.setStatus(DocumentFingerprint.FingerprintStatus.UNFINGERPRINTABLE);
            fp.setFailureReason(e.getMessage());
            ctx.addIssue(RunIssue.forDocument(RunIssue.Kind.FINGERPRINT_FAILURE, document.getId(), e.getMessage()));
            log.warn("Document {} of loan {} could not be fingerprinted: {}", document.getId(), ctx.getLoanId(), e.getMessage());
        }
        return fp;
    }

    /** Among equal exact hashes the lowest document id stays canonical; iteration is in id order. */
    static void markDuplicates(Map<String, DocumentFingerprint> fingerprintsById) {
        Map<String, String> canonicalByHash = new HashMap<>();
        for (DocumentFingerprint fp : fingerprintsById.values()) {
            if (fp.getStatus() != DocumentFingerprint.FingerprintStatus.FINGERPRINTED) {
                continue;
            }
            String canonical = canonicalByHash.putIfAbsent(fp.getExactHash(), fp.getDocumentId());
            if (canonical != null) {
                fp.setStatus(DocumentFingerprint.FingerprintStatus.EXACT_DUPLICATE);
                fp.setDuplicateOfDocumentId(canonical);
            }
        }
    }

    private DocumentClassification classifyOne(RunContext ctx, LoanDocument document, DocumentFingerprint fp,
                                               Map<String, DocumentContent> contents,
                                               Map<String, DocumentClassification> previous) {
        DocumentClassification before = previous.get(document.getId());
        if (intakeProperties.isReuseClassifications() && before != null && before.isClassified()
                && fp.getExactHash().equals(before.getExactHash())) {
            before.setExecutionId(ctx.getExecutionId());
            log.debug("Reusing classification of document {} (content unchanged)", document.getId());
            return before;
        }
        DocumentClassification c = new DocumentClassification();
        c.setId(ctx.getLoanId() + ":" + document.getId());
        c.setLoanId(ctx.getLoanId());
        c.setDocumentId(document.getId());
        c.setExecutionId(ctx.getExecutionId());
        c.setExactHash(fp.getExactHash());
        c.setAttempts(before != null ? before.getAttempts() + 1 : 1);
        c.setClassifiedAt(Instant.now());
        try {
            OracleJudgment j = classificationOracle.classify(document, contents.get(document.getId()));
            c.setStatus(DocumentClassification.ClassificationStatus.CLASSIFIED);
            c.setTypeLabel(j.typeLabel());
            c.setGroupingHint(j.groupingHint());
            c.setFinality(j.finality());
            c.setHasSignature(j.hasSignature());
            c.setDocumentDate(j.documentDate());
            c.setFields(new LinkedHashMap<>(j.fields()));
        } catch (OracleException e) {
            markNeedsReview(ctx, document, c, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected oracle client failure for document {}", document.getId(), e);
            markNeedsReview(ctx, document, c, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        return c;
    }

    private void markNeedsReview(RunContext ctx, LoanDocument document, DocumentClassification c, String reason) {
        c.setStatus(DocumentClassification.ClassificationStatus.NEEDS_REVIEW);
        c.setFailureReason(reason);
        ctx.addIssue(RunIssue.forDocument(RunIssue.Kind.ORACLE_FAILURE, document.getId(), reason));
        log.warn("Document {} of loan {} needs review: {}", document.getId(), ctx.getLoanId(), reason);
    }
}
