package com.loanrecon.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One structured field from the oracle payload: typed value plus the page it was read from (1-based, optional).
 */
@NoArgsConstructor
@Getter
@Setter
public class ExtractedField {

    private FieldValue value = FieldValue.missing();
    private Integer page;

    public ExtractedField(FieldValue value, Integer page) {
        this.value = value != null ? value : FieldValue.missing();
        this.page = page;
    }

    public boolean hasValue() {
        return value != null && !value.isMissing();
    }
}
