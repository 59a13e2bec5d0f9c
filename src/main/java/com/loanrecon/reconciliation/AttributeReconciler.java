package com.loanrecon.reconciliation;

import com.loanrecon.domain.DocumentClassification;
import com.loanrecon.domain.ExtractedField;
import com.loanrecon.domain.ManualAttributeValue;
import com.loanrecon.domain.ReconciledAttribute;
import com.loanrecon.domain.RunContext;
import com.loanrecon.domain.RunIssue;
import com.loanrecon.domain.SourceTier;
import com.loanrecon.reconciliation.config.ReconciliationProperties;
import com.loanrecon.reconciliation.config.ReconciliationProperties.AttributeDefinition;
import com.loanrecon.versioning.VersionResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chain: master of each instrument type in the configured order → reviewer-entered value → unsourced.
 * The first non-missing value wins and carries its document, page and tier. Never defaults to zero.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AttributeReconciler {

    private final ReconciliationProperties reconciliationProperties;
    private final VersionResolver versionResolver;

    /**
     * @return attributes keyed by name, in definition order
     */
    public Map<String, ReconciledAttribute> reconcile(RunContext ctx, List<ManualAttributeValue> manualValues) {
        MasterDocumentIndex masters = MasterDocumentIndex.build(ctx, versionResolver);
        Map<String, ReconciledAttribute> out = new LinkedHashMap<>();
        for (AttributeDefinition def : reconciliationProperties.getAttributes()) {
            ReconciledAttribute a = reconcileOne(ctx, def, masters, manualValues);
            out.put(def.getName(), a);
        }
        long unsourced = out.values().stream().filter(ReconciledAttribute::isUnsourced).count();
        log.info("Reconciled {} attributes for loan {} run {} ({} unsourced)",
                out.size(), ctx.getLoanId(), ctx.getExecutionId(), unsourced);
        return out;
    }

    ReconciledAttribute reconcileOne(RunContext ctx, AttributeDefinition def, MasterDocumentIndex masters,
                                     List<ManualAttributeValue> manualValues) {
        List<String> chain = def.getChain() != null && !def.getChain().isEmpty()
                ? def.getChain()
                : reconciliationProperties.getDefaultChain();
        Optional<ReconciledAttribute> r = fromInstrumentChain(ctx, def, chain, masters);
        if (r.isPresent()) {
            return r.get();
        }
        if (reconciliationProperties.isManualTierEnabled()) {
            r = fromManualEntries(ctx, def, chain.size(), manualValues);
            if (r.isPresent()) {
                return r.get();
            }
        }
        ctx.addIssue(RunIssue.forAttribute(RunIssue.Kind.UNSOURCED_ATTRIBUTE, def.getName(), null, null,
                "No source in chain " + chain + (reconciliationProperties.isManualTierEnabled() ? " or manual entries" : "")));
        log.warn("Attribute {} of loan {} is unsourced", def.getName(), ctx.getLoanId());
        return ReconciledAttribute.unsourced(ctx.getLoanId(), ctx.getExecutionId(), def.getName(), def.getUnit());
    }

    private Optional<ReconciledAttribute> fromInstrumentChain(RunContext ctx, AttributeDefinition def,
                                                              List<String> chain, MasterDocumentIndex masters) {
        for (int tier = 0; tier < chain.size(); tier++) {
            String type = chain.get(tier);
            Optional<String> masterId = masters.masterFor(type);
            if (masterId.isEmpty()) {
                continue;
            }
            DocumentClassification c = ctx.getClassifications().get(masterId.get());
            if (c == null) {
                continue;
            }
            for (String key : def.effectiveFieldKeys()) {
                Optional<ExtractedField> f = c.field(key).filter(ExtractedField::hasValue);
                if (f.isPresent()) {
                    ReconciledAttribute a = sourced(ctx, def, f.get(), masterId.get());
                    a.setSourceTier(tier == 0 ? SourceTier.PRIMARY : SourceTier.FALLBACK);
                    a.setSourceTierIndex(tier);
                    a.setSourceInstrumentType(type);
                    if (tier > 0) {
                        log.debug("Attribute {} of loan {} sourced from fallback tier {} ({})",
                                def.getName(), ctx.getLoanId(), tier, type);
                    }
                    return Optional.of(a);
                }
            }
        }
        return Optional.empty();
    }

    /** Latest reviewer entry with a value and a cited document. */
    private Optional<ReconciledAttribute> fromManualEntries(RunContext ctx, AttributeDefinition def, int tierIndex,
                                                            List<ManualAttributeValue> manualValues) {
        if (manualValues == null) {
            return Optional.empty();
        }
        return manualValues.stream()
                .filter(m -> def.getName().equals(m.getAttributeName()))
                .filter(m -> m.getValue() != null && !m.getValue().isMissing())
                .filter(m -> m.getDocumentId() != null && ctx.document(m.getDocumentId()) != null)
                .max(Comparator.comparing(ManualAttributeValue::getEnteredAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .map(m -> {
                    ReconciledAttribute a = sourced(ctx, def, new ExtractedField(m.getValue(), m.getPage()), m.getDocumentId());
                    a.setSourceTier(SourceTier.MANUAL);
                    a.setSourceTierIndex(tierIndex);
                    a.setSourceInstrumentType(null);
                    return a;
                });
    }

    private static ReconciledAttribute sourced(RunContext ctx, AttributeDefinition def, ExtractedField field, String documentId) {
        ReconciledAttribute a = new ReconciledAttribute();
        a.setId(ctx.getLoanId() + ":" + def.getName());
        a.setLoanId(ctx.getLoanId());
        a.setExecutionId(ctx.getExecutionId());
        a.setName(def.getName());
        a.setUnit(def.getUnit());
        a.setValue(field.getValue());
        a.setSourceDocumentId(documentId);
        a.setSourcePage(field.getPage());
        a.setUnsourced(false);
        a.setReconciledAt(Instant.now());
        return a;
    }
}
