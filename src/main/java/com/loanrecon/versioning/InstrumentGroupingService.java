package com.loanrecon.versioning;

import com.loanrecon.common.UnionFind;
import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.DocumentFingerprint;
import com.loanrecon.domain.GroupingConflict;
import com.loanrecon.domain.InstrumentGroup;
import com.loanrecon.domain.LoanDocument;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.ingestion.identity.ContentFingerprinter;
import com.loanrecon.versioning.config.GroupingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Clusters a loan's canonical, classified documents into instrument groups with union-find.
 * Oracle hint edges are applied first; fingerprint edges join components only when hints and type labels agree.
 * Iteration is in document-id order, so the output is deterministic.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InstrumentGroupingService {

    private final GroupingProperties groupingProperties;

    public List<InstrumentGroup> group(RunContext ctx) {
        List<LoanDocument> docs = ctx.groupingCandidates();
        List<String> ids = docs.stream().map(LoanDocument::getId).sorted().toList();
        Map<String, DocumentClassification> cls = ctx.getClassifications();
        Map<String, DocumentFingerprint> fps = ctx.getFingerprints();
        UnionFind uf = new UnionFind(ids);

        Map<String, String> firstByHint = new HashMap<>();
        for (String id : ids) {
            String hint = hintOf(cls.get(id));
            if (hint == null) {
                continue;
            }
            String first = firstByHint.putIfAbsent(hint, id);
            if (first != null) {
                uf.union(first, id);
            }
        }

        Map<String, ComponentMeta> meta = new HashMap<>();
        for (String id : ids) {
            ComponentMeta m = meta.computeIfAbsent(uf.find(id), r -> new ComponentMeta());
            m.absorb(hintOf(cls.get(id)), labelOf(cls.get(id)));
        }

        double threshold = groupingProperties.getSimilarityThreshold();
        List<GroupingConflict> conflicts = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            for (int j = i + 1; j < ids.size(); j++) {
                String a = ids.get(i);
                String b = ids.get(j);
                if (uf.connected(a, b)) {
                    continue;
                }
                double sim = ContentFingerprinter.similarity(fps.get(a).getPerceptualHash(), fps.get(b).getPerceptualHash());
                if (sim < threshold) {
                    continue;
                }
                ComponentMeta ma = meta.get(uf.find(a));
                ComponentMeta mb = meta.get(uf.find(b));
                String reason = ma.conflictWith(mb);
                if (reason != null) {
                    GroupingConflict c = new GroupingConflict(a, b, sim, ma.label, mb.label, reason);
                    conflicts.add(c);
                    ctx.addIssue(RunIssue.forDocument(RunIssue.Kind.GROUPING_CONFLICT, a,
                            "Similar to " + b + " (" + String.format("%.3f", sim) + ") but " + reason));
                    log.warn("Grouping conflict in loan {}: {} ~ {} similarity {} but {}; oracle wins",
                            ctx.getLoanId(), a, b, String.format("%.3f", sim), reason);
                    continue;
                }
                String oldA = uf.find(a);
                String oldB = uf.find(b);
                String root = uf.union(a, b);
                ComponentMeta merged = new ComponentMeta();
                merged.absorb(meta.remove(oldA));
                merged.absorb(meta.remove(oldB));
                meta.put(root, merged);
            }
        }

        List<InstrumentGroup> groups = new ArrayList<>();
        Map<String, InstrumentGroup> groupByDocument = new HashMap<>();
        for (Map.Entry<String, List<String>> set : uf.sets().entrySet()) {
            InstrumentGroup g = buildGroup(ctx, set.getValue(), meta.get(set.getKey()), cls);
            groups.add(g);
            set.getValue().forEach(id -> groupByDocument.put(id, g));
        }
        for (GroupingConflict c : conflicts) {
            InstrumentGroup ga = groupByDocument.get(c.getDocumentId());
            InstrumentGroup gb = groupByDocument.get(c.getOtherDocumentId());
            ga.getConflicts().add(c);
            if (gb != ga) {
                gb.getConflicts().add(c);
            }
        }
        groups.sort(Comparator.comparing(InstrumentGroup::getGroupKey));
        log.info("Grouped {} documents of loan {} into {} instrument groups ({} conflicts)",
                ids.size(), ctx.getLoanId(), groups.size(), conflicts.size());
        return groups;
    }

    private static InstrumentGroup buildGroup(RunContext ctx, List<String> members, ComponentMeta meta,
                                              Map<String, DocumentClassification> cls) {
        String type = null;
        for (String id : members) {
            type = labelOf(cls.get(id));
            if (type != null) {
                break;
            }
        }
        String key = meta != null && meta.hint != null
                ? "hint:" + meta.hint
                : "fp:" + (type != null ? type : "unlabelled") + ":" + members.get(0);
        InstrumentGroup g = new InstrumentGroup();
        g.setId(ctx.getLoanId() + ":" + key);
        g.setLoanId(ctx.getLoanId());
        g.setExecutionId(ctx.getExecutionId());
        g.setGroupKey(key);
        g.setInstrumentType(type);
        g.setMemberDocumentIds(new ArrayList<>(members));
        g.setStatus(InstrumentGroup.GroupStatus.UNRESOLVED);
        return g;
    }

    private static String hintOf(DocumentClassification c) {
        return c == null || c.getGroupingHint() == null || c.getGroupingHint().isBlank() ? null : c.getGroupingHint().trim();
    }

    private static String labelOf(DocumentClassification c) {
        return c == null || c.getTypeLabel() == null || c.getTypeLabel().isBlank() ? null : c.getTypeLabel().trim();
    }

    /** Hint and first type label of a component, in member-id order. */
    private static final class ComponentMeta {
        private String hint;
        private String label;

        void absorb(String h, String l) {
            if (hint == null) {
                hint = h;
            }
            if (label == null) {
                label = l;
            }
        }

        void absorb(ComponentMeta other) {
            if (other != null) {
                absorb(other.hint, other.label);
            }
        }

        String conflictWith(ComponentMeta other) {
            if (hint != null && other.hint != null && !hint.equals(other.hint)) {
                return "grouping hints differ (" + hint + " vs " + other.hint + ")";
            }
            if (label != null && other.label != null && !label.equals(other.label)) {
                return "type labels differ (" + label + " vs " + other.label + ")";
            }
            return null;
        }
    }
}
