package com.vidnyan.smelldsl.domain.rule;

import java.util.Arrays;

/**
 * Operators a rule condition may compare with.
 * Any other symbol maps to {@link #UNSUPPORTED}, which never triggers.
 */
public enum ComparisonOperator {
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    UNSUPPORTED("");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static ComparisonOperator fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op != UNSUPPORTED && op.symbol.equals(symbol))
                .findFirst()
                .orElse(UNSUPPORTED);
    }

    public boolean test(double measured, double threshold) {
        return switch (this) {
            case GREATER -> measured > threshold;
            case GREATER_OR_EQUAL -> measured >= threshold;
            case UNSUPPORTED -> false;
        };
    }
}
