package com.loanrecon.reconciliation;

import com.loanrecon.domain.InstrumentGroup;
import com.loanrecon.domain.RunContext;
import com.loanrecon.versioning.VersionComparator;
import com.loanrecon.versioning.VersionFacts;
import com.loanrecon.versioning.VersionResolver;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Master document per instrument type for one run. When several resolved groups share a type, the group whose
 * master ranks first under that type's version comparator wins.
 */
public final class MasterDocumentIndex {

    private final Map<String, String> masterByType;

    private MasterDocumentIndex(Map<String, String> masterByType) {
        this.masterByType = Collections.unmodifiableMap(masterByType);
    }

    public static MasterDocumentIndex build(RunContext ctx, VersionResolver versionResolver) {
        Map<String, VersionFacts> best = new HashMap<>();
        for (InstrumentGroup g : ctx.getGroups()) {
            if (g.getInstrumentType() == null) {
                continue;
            }
            Optional<String> master = g.masterDocumentId();
            if (master.isEmpty()) {
                continue;
            }
            String type = g.getInstrumentType();
            VersionFacts candidate = VersionFacts.of(ctx.document(master.get()), ctx.getClassifications().get(master.get()));
            VersionFacts current = best.get(type);
            VersionComparator comparator = versionResolver.comparatorFor(type);
            if (current == null || comparator.compare(candidate, current) < 0) {
                best.put(type, candidate);
            }
        }
        Map<String, String> out = new HashMap<>();
        best.forEach((type, facts) -> out.put(type, facts.documentId()));
        return new MasterDocumentIndex(out);
    }

    public Optional<String> masterFor(String instrumentType) {
        return Optional.ofNullable(masterByType.get(instrumentType));
    }
}
