package com.tsa.condition;

import java.util.Arrays;
import java.util.Optional;

/**
 * Binary operators of a primary block.
 */
public enum Operator {
    EQUALS("="),
    NOT_EQUALS("<>"),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUALS(">="),
    LESS_THAN_OR_EQUALS("<="),
    IN("in");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public static Optional<Operator> fromSymbol(String symbol) {
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(symbol))
                .findFirst();
    }

    /**
     * Whether an observed value that compares to the reference as
     * {@code comparison} (negative, zero or positive) satisfies this operator.
     * Not defined for {@link #IN}.
     */
    public boolean accepts(int comparison) {
        return switch (this) {
            case EQUALS -> comparison == 0;
            case NOT_EQUALS -> comparison != 0;
            case GREATER_THAN -> comparison > 0;
            case LESS_THAN -> comparison < 0;
            case GREATER_THAN_OR_EQUALS -> comparison >= 0;
            case LESS_THAN_OR_EQUALS -> comparison <= 0;
            case IN -> throw new UnsupportedOperationException("\"in\" compares against tuple members");
        };
    }

    @Override
    public String toString() {
        return symbol;
    }
}
