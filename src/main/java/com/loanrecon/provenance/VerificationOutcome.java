package com.loanrecon.provenance;

import com.loanrecon.domain.VerificationStatus;

import java.math.BigDecimal;

public record VerificationOutcome(VerificationStatus status, BigDecimal absoluteDifference, BigDecimal variancePct) {
}
