package com.loanrecon.provenance;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;

/**
 * Named arithmetic over parent step values (in declared parent order).
 */
public enum Formula {

    SUM(1, Integer.MAX_VALUE),
    /** First minus all the rest. */
    SUBTRACT(2, Integer.MAX_VALUE),
    MULTIPLY(2, Integer.MAX_VALUE),
    DIVIDE(2, 2),
    /** First × factor / 100. */
    PERCENTAGE(1, 1),
    ANNUAL_TO_MONTHLY(1, 1),
    MONTHLY_TO_ANNUAL(1, 1);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal TWELVE = BigDecimal.valueOf(12);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final int minArgs;
    private final int maxArgs;

    Formula(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    public boolean acceptsArity(int n) {
        return n >= minArgs && n <= maxArgs;
    }

    public String arityDescription() {
        if (minArgs == maxArgs) {
            return String.valueOf(minArgs);
        }
        return maxArgs == Integer.MAX_VALUE ? "at least " + minArgs : minArgs + ".." + maxArgs;
    }

    /**
     * @throws ProvenanceException on division by zero or a missing factor
     */
    public BigDecimal apply(List<BigDecimal> args, BigDecimal factor) {
        switch (this) {
            case SUM:
                return args.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            case SUBTRACT: {
                BigDecimal r = args.get(0);
                for (int i = 1; i < args.size(); i++) {
                    r = r.subtract(args.get(i));
                }
                return r;
            }
            case MULTIPLY:
                return args.stream().reduce(BigDecimal.ONE, (a, b) -> a.multiply(b, MC));
            case DIVIDE:
                if (args.get(1).signum() == 0) {
                    throw new ProvenanceException("Division by zero");
                }
                return args.get(0).divide(args.get(1), MC);
            case PERCENTAGE:
                if (factor == null) {
                    throw new ProvenanceException("PERCENTAGE requires a factor");
                }
                return args.get(0).multiply(factor, MC).divide(HUNDRED, MC);
            case ANNUAL_TO_MONTHLY:
                return args.get(0).divide(TWELVE, MC);
            case MONTHLY_TO_ANNUAL:
                return args.get(0).multiply(TWELVE);
            default:
                throw new IllegalStateException("Unhandled formula " + this);
        }
    }
}
