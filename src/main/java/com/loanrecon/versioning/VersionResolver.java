package com.loanrecon.versioning;

import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.InstrumentGroup;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.VersionCriterion;
import com.loanrecon.domain.VersionRecord;
import com.loanrecon.versioning.config.VersioningProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Version resolution state machine: UNRESOLVED -> RESOLVED. Always recomputes the full order, so re-resolving a
 * group after membership changes is safe. Rank 0 is MASTER (UNIQUE for singletons), the rest SUPERSEDED.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VersionResolver {

    private final VersioningProperties versioningProperties;

    public VersionComparator comparatorFor(String instrumentType) {
        List<VersionCriterion> byType = instrumentType != null
                ? versioningProperties.getPrecedenceByType().get(instrumentType)
                : null;
        return new VersionComparator(byType != null && !byType.isEmpty() ? byType : versioningProperties.getDefaultPrecedence());
    }

    public List<InstrumentGroup> resolveAll(RunContext ctx, List<InstrumentGroup> groups) {
        List<InstrumentGroup> out = new ArrayList<>(groups.size());
        for (InstrumentGroup g : groups) {
            out.add(resolve(g, ctx.getDocuments(), ctx.getClassifications()));
        }
        return out;
    }

    public InstrumentGroup resolve(InstrumentGroup group,
                                   Map<String, LoanDocument> documents,
                                   Map<String, DocumentClassification> classifications) {
        List<VersionFacts> facts = new ArrayList<>();
        for (String id : group.getMemberDocumentIds()) {
            LoanDocument d = documents.get(id);
            if (d == null) {
                throw new IllegalStateException("Group " + group.getId() + " references unknown document " + id);
            }
            facts.add(VersionFacts.of(d, classifications.get(id)));
        }
        VersionComparator comparator = comparatorFor(group.getInstrumentType());
        facts.sort(comparator);

        List<VersionRecord> versions = new ArrayList<>(facts.size());
        for (int rank = 0; rank < facts.size(); rank++) {
            VersionFacts f = facts.get(rank);
            if (rank == 0) {
                VersionRecord.Role role = facts.size() == 1 ? VersionRecord.Role.UNIQUE : VersionRecord.Role.MASTER;
                versions.add(new VersionRecord(f.documentId(), 0, role, null, false));
                continue;
            }
            VersionCriterion decidedBy = comparator.separatingCriterion(facts.get(rank - 1), f)
                    .orElse(VersionCriterion.DOCUMENT_ID);
            boolean byId = decidedBy == VersionCriterion.DOCUMENT_ID;
            if (byId) {
                log.info("Group {}: {} ranked below {} by document id only; order is arbitrary but stable",
                        group.getId(), f.documentId(), facts.get(rank - 1).documentId());
            }
            versions.add(new VersionRecord(f.documentId(), rank, VersionRecord.Role.SUPERSEDED, decidedBy, byId));
        }
        group.setVersions(versions);
        group.setStatus(InstrumentGroup.GroupStatus.RESOLVED);
        group.setResolvedAt(Instant.now());
        log.debug("Resolved group {} ({} versions, master {})", group.getId(), versions.size(),
                versions.isEmpty() ? "-" : versions.get(0).getDocumentId());
        return group;
    }
}
