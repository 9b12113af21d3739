package com.tsa.condition;

/**
 * Kinds of blocks a condition consists of.
 */
public enum BlockType {
    /**
     * Comparison of one station sensor against a value.
     */
    PRIMARY,

    /**
     * Reference to the result of another condition.
     */
    SECONDARY
}
