package com.loanrecon.api.dto;

/**
 * One reconciled attribute with its single source citation. {@code value} is null when unsourced.
 */
public record AttributeResponse(
        String name,
        String value,
        String valueKind,
        String unit,
        String sourceDocumentId,
        Integer sourcePage,
        String sourceTier,
        String sourceInstrumentType,
        boolean unsourced,
        String executionId
) {
}
