package com.loanrecon.ingestion.oracle;

import com.loanrecon.domain.ExtractedField;
import com.loanrecon.domain.FinalityIndicator;

import java.time.LocalDate;
import java.util.Map;

/**
 * Typed oracle output. Every structured field is already coerced to a {@link com.loanrecon.domain.FieldValue}.
 */
public record OracleJudgment(
        String typeLabel,
        String groupingHint,
        FinalityIndicator finality,
        Boolean hasSignature,
        LocalDate documentDate,
        Map<String, ExtractedField> fields
) {

    public OracleJudgment {
        finality = finality != null ? finality : FinalityIndicator.UNKNOWN;
        fields = fields != null ? Map.copyOf(fields) : Map.of();
    }
}
