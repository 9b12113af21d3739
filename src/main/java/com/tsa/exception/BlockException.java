package com.tsa.exception;

/**
 * Exception thrown when a leaf of a condition cannot be turned into a block,
 * e.g. too many {@code #} separators or operators, or an {@code in} operator
 * without a parenthesized tuple.
 */
public class BlockException extends TsaException {

    private final String leaf;
    private final int position;

    public BlockException(String message, String leaf, int position) {
        super(ErrorKind.BLOCK, message + ": " + leaf);
        this.leaf = leaf;
        this.position = position;
    }

    public String getLeaf() {
        return leaf;
    }

    @Override
    public int getPosition() {
        return position;
    }
}
