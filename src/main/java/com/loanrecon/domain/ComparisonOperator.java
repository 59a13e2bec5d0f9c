package com.loanrecon.domain;

import java.math.BigDecimal;

public enum ComparisonOperator {
    LT("<"),
    LTE("≤"),
    GT(">"),
    GTE("≥"),
    EQ("=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** True when {@code actual OP limit} holds. */
    public boolean test(BigDecimal actual, BigDecimal limit) {
        int c = actual.compareTo(limit);
        return switch (this) {
            case LT -> c < 0;
            case LTE -> c <= 0;
            case GT -> c > 0;
            case GTE -> c >= 0;
            case EQ -> c == 0;
        };
    }
}
