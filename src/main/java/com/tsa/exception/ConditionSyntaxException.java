package com.tsa.exception;

/**
 * Exception thrown when a condition string violates the condition grammar:
 * unbalanced parentheses, an empty condition or a forbidden token sequence.
 */
public class ConditionSyntaxException extends TsaException {

    private final String leftToken;
    private final String rightToken;
    private final int position;

    public ConditionSyntaxException(String message, int position) {
        this(message, null, null, position);
    }

    public ConditionSyntaxException(String message, String leftToken, String rightToken, int position) {
        super(ErrorKind.SYNTAX, message);
        this.leftToken = leftToken;
        this.rightToken = rightToken;
        this.position = position;
    }

    /**
     * First offending token, or null when the error is not about adjacency.
     */
    public String getLeftToken() {
        return leftToken;
    }

    /**
     * Second offending token, or null when the error concerns a single token.
     */
    public String getRightToken() {
        return rightToken;
    }

    @Override
    public int getPosition() {
        return position;
    }
}
