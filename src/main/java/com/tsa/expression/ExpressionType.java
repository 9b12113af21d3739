package com.tsa.expression;

/**
 * Node types of an alias expression tree.
 */
public enum ExpressionType {
    // Logical
    AND,
    OR,
    NOT,

    // Leaf
    ALIAS
}
