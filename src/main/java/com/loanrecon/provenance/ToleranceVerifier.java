package com.loanrecon.provenance;

import com.loanrecon.domain.VerificationStatus;
import com.loanrecon.provenance.config.ProvenanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Exact equality or |calc - expected| &lt; epsilonAbs → MATCH; else variance % of |expected| &lt; epsilonPct → MINOR_VARIANCE;
 * else MISMATCH. A zero expected value with a non-zero difference is always a MISMATCH.
 */
@Component
@RequiredArgsConstructor
public class ToleranceVerifier {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ProvenanceProperties provenanceProperties;

    public VerificationOutcome verify(BigDecimal calculated, BigDecimal expected) {
        return verify(calculated, expected, provenanceProperties.getEpsilonAbs(), provenanceProperties.getEpsilonPct());
    }

    public static VerificationOutcome verify(BigDecimal calculated, BigDecimal expected,
                                             BigDecimal epsilonAbs, BigDecimal epsilonPct) {
        if (calculated == null || expected == null) {
            return new VerificationOutcome(VerificationStatus.MISSING_INPUT, null, null);
        }
        BigDecimal diff = calculated.subtract(expected).abs();
        BigDecimal pct = expected.signum() == 0
                ? null
                : diff.multiply(HUNDRED).divide(expected.abs(), MathContext.DECIMAL64);
        if (diff.signum() == 0 || diff.compareTo(epsilonAbs) < 0) {
            return new VerificationOutcome(VerificationStatus.MATCH, diff, pct);
        }
        if (pct != null && pct.compareTo(epsilonPct) < 0) {
            return new VerificationOutcome(VerificationStatus.MINOR_VARIANCE, diff, pct);
        }
        return new VerificationOutcome(VerificationStatus.MISMATCH, diff, pct);
    }
}
