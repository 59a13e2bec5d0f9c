package com.loanrecon.api.dto;

import com.loanrecon.api.validation.KnownAttribute;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * POST /api/v1/loans/{loanId}/manual-attributes request body. {@code value} is coerced the same way oracle
 * values are (number, date, yes/no, text).
 */
public record ManualAttributeRequest(
        @NotBlank(message = "INVALID_ATTRIBUTE")
        @KnownAttribute
        String attributeName,

        @NotBlank(message = "INVALID_VALUE")
        String value,

        @NotBlank(message = "INVALID_CITATION")
        String documentId,

        @Positive(message = "INVALID_CITATION")
        Integer page,

        @NotBlank(message = "INVALID_REVIEWER")
        String enteredBy,

        String note
) {
}
