package com.tsa.condition;

/**
 * One leaf sub-expression of a condition.
 * <p>
 * Blocks are compared by their normalized raw text: two leaves with the same
 * text within one condition are the same block and share one alias.
 */
public interface Block {

    /**
     * Alias of this block, unique within its condition, e.g. {@code c4_0}.
     */
    String alias();

    /**
     * Normalized leaf text the block was built from.
     */
    String rawText();

    BlockType getType();

    default boolean isSecondary() {
        return getType() == BlockType.SECONDARY;
    }
}
