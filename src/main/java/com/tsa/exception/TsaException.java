package com.tsa.exception;

/**
 * Base exception for the condition analyzer.
 * Every subclass reports the {@link ErrorKind} it belongs to so that
 * collected errors can be grouped without inspecting the exception type.
 */
public class TsaException extends RuntimeException {

    private final ErrorKind kind;

    public TsaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TsaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Character offset in the normalized condition text, or -1 when the
     * error is not bound to a position.
     */
    public int getPosition() {
        return -1;
    }
}
