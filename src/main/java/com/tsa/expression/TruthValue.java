package com.tsa.expression;

/**
 * Three-valued truth with SQL NULL semantics.
 * <p>
 * {@code false} dominates AND, {@code true} dominates OR, and
 * {@link #UNKNOWN} propagates otherwise.
 */
public enum TruthValue {
    TRUE,
    FALSE,
    UNKNOWN;

    public TruthValue and(TruthValue other) {
        if (this == FALSE || other == FALSE) {
            return FALSE;
        }
        if (this == TRUE && other == TRUE) {
            return TRUE;
        }
        return UNKNOWN;
    }

    public TruthValue or(TruthValue other) {
        if (this == TRUE || other == TRUE) {
            return TRUE;
        }
        if (this == FALSE && other == FALSE) {
            return FALSE;
        }
        return UNKNOWN;
    }

    public TruthValue not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Maps null to {@link #UNKNOWN}.
     */
    public static TruthValue of(Boolean value) {
        if (value == null) {
            return UNKNOWN;
        }
        return value ? TRUE : FALSE;
    }

    /**
     * Inverse of {@link #of(Boolean)}: null for {@link #UNKNOWN}.
     */
    public Boolean toBoolean() {
        return switch (this) {
            case TRUE -> Boolean.TRUE;
            case FALSE -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }
}
