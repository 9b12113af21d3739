package com.tsa.config.expression;

/**
 * Represents a token of a condition.
 *
 * @param type     Token type
 * @param text     Normalized text; for leaves the whole sub-expression
 * @param position Position in the normalized condition string
 */
public record Token(TokenType type, String text, int position) {

    public boolean isLeaf() {
        return type == TokenType.LEAF;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
