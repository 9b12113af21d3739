package com.tsa.exception;

/**
 * Categories of errors raised while compiling and evaluating conditions.
 */
public enum ErrorKind {
    SYNTAX,
    IDENTIFIER,
    BLOCK,
    DUPLICATE_CONDITION,
    UNRESOLVED_REFERENCE,
    DEPENDENCY_CYCLE,
    STORE,
    CONFIGURATION,
    /**
     * Unexpected failure that is not one of the categories above.
     */
    INTERNAL
}
