package com.loanrecon.domain;

import java.util.Locale;

/**
 * Oracle-supplied version/finality indicator. Higher {@link #weight()} is more authoritative.
 */
public enum FinalityIndicator {
    FINAL(3),
    PRELIMINARY(2),
    INITIAL(1),
    UNKNOWN(0);

    private final int weight;

    FinalityIndicator(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Lenient parse of oracle labels ("Final", "prelim", "draft", "initial disclosure").
     */
    public static FinalityIndicator parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String s = raw.trim().toLowerCase(Locale.ROOT);
        if (s.contains("final")) {
            return FINAL;
        }
        if (s.contains("prelim")) {
            return PRELIMINARY;
        }
        if (s.contains("initial") || s.contains("draft")) {
            return INITIAL;
        }
        return UNKNOWN;
    }
}
