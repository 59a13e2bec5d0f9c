package com.loanrecon.versioning;

import com.loanrecon.LoanFixtures;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentFingerprint;
import com.loanrecon.domain.FinalityIndicator;
import com.loanrecon.domain.InstrumentGroup;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.versioning.config.GroupingProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.loanrecon.LoanFixtures.byDocument;
import static com.loanrecon.LoanFixtures.classification;
import static com.loanrecon.LoanFixtures.document;
import static com.loanrecon.LoanFixtures.fingerprint;
import static com.loanrecon.LoanFixtures.phash;
import static org.assertj.core.api.Assertions.assertThat;

class InstrumentGroupingServiceTest {

    private final InstrumentGroupingService service = new InstrumentGroupingService(new GroupingProperties());

    @Test
    @DisplayName("perceptually similar drafts of the same type form one group")
    void similarDraftsAreGrouped() {
        RunContext ctx = context(List.of(document("d1", 5), document("d2", 5), document("d3", 5), document("d4", 30)),
                byDocument(fingerprint("d1", "h1", phash(0)), fingerprint("d2", "h2", phash(1)),
                        fingerprint("d3", "h3", phash(2)), fingerprint("d4", "h4", phash(60))),
                byDocument(cls("d1", "closing_disclosure", null), cls("d2", "closing_disclosure", null),
                        cls("d3", "closing_disclosure", null), cls("d4", "appraisal", null)));

        List<InstrumentGroup> groups = service.group(ctx);

        assertThat(groups).extracting(InstrumentGroup::getGroupKey)
                .containsExactly("fp:appraisal:d4", "fp:closing_disclosure:d1");
        assertThat(groups.get(1).getMemberDocumentIds()).containsExactly("d1", "d2", "d3");
        assertThat(groups.get(1).getInstrumentType()).isEqualTo("closing_disclosure");
        assertThat(groups).allMatch(g -> g.getStatus() == InstrumentGroup.GroupStatus.UNRESOLVED);
    }

    @Test
    @DisplayName("an oracle grouping hint joins documents that do not look alike")
    void hintJoinsDissimilarDocuments() {
        RunContext ctx = context(List.of(document("d1", 3), document("d5", 3)),
                byDocument(fingerprint("d1", "h1", phash(0)), fingerprint("d5", "h5", phash(60))),
                byDocument(cls("d1", "loan_estimate", "LE-1"), cls("d5", "loan_estimate", "LE-1")));

        List<InstrumentGroup> groups = service.group(ctx);

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getGroupKey()).isEqualTo("hint:LE-1");
        assertThat(groups.get(0).getId()).isEqualTo(LoanFixtures.LOAN_ID + ":hint:LE-1");
        assertThat(groups.get(0).getMemberDocumentIds()).containsExactly("d1", "d5");
    }

    @Test
    @DisplayName("similar documents with different type labels stay apart and record a conflict")
    void conflictingLabelsAreNotMerged() {
        RunContext ctx = context(List.of(document("d1", 3), document("d2", 3)),
                byDocument(fingerprint("d1", "h1", phash(0)), fingerprint("d2", "h2", phash(1))),
                byDocument(cls("d1", "loan_estimate", null), cls("d2", "closing_disclosure", null)));

        List<InstrumentGroup> groups = service.group(ctx);

        assertThat(groups).hasSize(2);
        assertThat(groups).allSatisfy(g -> assertThat(g.getConflicts()).hasSize(1));
        assertThat(groups.get(0).getConflicts().get(0).getReason()).contains("type labels differ");
        assertThat(ctx.issuesSnapshot()).extracting(RunIssue::getKind).containsExactly(RunIssue.Kind.GROUPING_CONFLICT);
    }

    @Test
    @DisplayName("duplicates and NEEDS_REVIEW documents are not grouped")
    void excludesDuplicatesAndUnclassified() {
        DocumentFingerprint dup = fingerprint("d2", "h1", phash(0));
        dup.setStatus(DocumentFingerprint.FingerprintStatus.EXACT_DUPLICATE);
        DocumentClassification review = cls("d3", null, null);
        review.setStatus(DocumentClassification.ClassificationStatus.NEEDS_REVIEW);
        RunContext ctx = context(List.of(document("d1", 3), document("d2", 3), document("d3", 3)),
                byDocument(fingerprint("d1", "h1", phash(0)), dup, fingerprint("d3", "h3", phash(0))),
                byDocument(cls("d1", "w2", null), review));

        List<InstrumentGroup> groups = service.group(ctx);

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).getMemberDocumentIds()).containsExactly("d1");
    }

    @Test
    @DisplayName("grouping does not depend on document order")
    void deterministicAcrossInputOrder() {
        List<LoanDocument> docs = new ArrayList<>();
        List<DocumentFingerprint> fps = new ArrayList<>();
        List<DocumentClassification> cs = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String id = "d" + i;
            docs.add(document(id, 2));
            fps.add(fingerprint(id, "h" + i, phash(i % 2 == 0 ? i / 2 : 40 + i / 2)));
            cs.add(cls(id, i % 2 == 0 ? "paystub" : "bank_statement", null));
        }
        List<InstrumentGroup> expected = service.group(context(docs,
                byDocument(fps.toArray(new DocumentFingerprint[0])), byDocument(cs.toArray(new DocumentClassification[0]))));

        List<LoanDocument> shuffled = new ArrayList<>(docs);
        Collections.shuffle(shuffled, new Random(7));
        List<InstrumentGroup> actual = service.group(context(shuffled,
                byDocument(fps.toArray(new DocumentFingerprint[0])), byDocument(cs.toArray(new DocumentClassification[0]))));

        assertThat(actual).extracting(InstrumentGroup::getGroupKey)
                .containsExactlyElementsOf(expected.stream().map(InstrumentGroup::getGroupKey).toList());
        assertThat(actual).extracting(InstrumentGroup::getMemberDocumentIds)
                .containsExactlyElementsOf(expected.stream().map(InstrumentGroup::getMemberDocumentIds).toList());
    }

    private static DocumentClassification cls(String id, String type, String hint) {
        return classification(id, type, hint, FinalityIndicator.UNKNOWN, null, null);
    }

    private static RunContext context(List<LoanDocument> docs,
                                      Map<String, DocumentFingerprint> fps,
                                      Map<String, DocumentClassification> cls) {
        RunContext ctx = new RunContext(LoanFixtures.LOAN_ID, "exec-1", docs);
        ctx.recordIntake(fps, cls);
        return ctx;
    }
}
