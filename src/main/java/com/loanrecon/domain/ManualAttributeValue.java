package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Reviewer-entered value for the manual fallback tier. Must cite the document (and page) it was read from.
 */
@Document(collection = "manual_attribute_values")
@CompoundIndex(name = "loan_attribute", def = "{'loanId': 1, 'attributeName': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ManualAttributeValue {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanId;
    private String attributeName;
    private FieldValue value = FieldValue.missing();
    private String documentId;
    private Integer page;
    private String enteredBy;
    private String note;
    private Instant enteredAt;
}
