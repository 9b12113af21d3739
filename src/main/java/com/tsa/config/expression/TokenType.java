package com.tsa.config.expression;

/**
 * Token types of the condition grammar.
 */
public enum TokenType {
    // Delimiters
    OPEN_PAREN,
    CLOSE_PAREN,

    // Logical operators
    AND_OR,
    NOT,

    // Station#sensor comparison or reference to another condition
    LEAF
}
