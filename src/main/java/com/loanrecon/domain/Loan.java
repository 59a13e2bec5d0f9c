package com.loanrecon.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;

/**
 * Loan header owned by the surrounding application. Read-only here; supplies applicability facts for compliance.
 */
@Document(collection = "loans")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Loan {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String loanNumber;
    /** e.g. CONVENTIONAL, FHA, VA, HELOC. */
    private String loanType;
    /** Two-letter property state code. */
    private String propertyState;
    private LocalDate applicationDate;
}
