package com.tsa.exception;

/**
 * Exception thrown when a site, station, sensor or alias name cannot be
 * turned into a canonical identifier.
 * <p>
 * Carries the offending text and the character index so that the error can
 * be shown with a pointer line:
 * <pre>
 * String contains an invalid character:
 * kitka-luku
 * ~~~~~^
 * </pre>
 */
public class IdentifierException extends TsaException {

    /**
     * Why the name was rejected.
     */
    public enum Reason {
        EMPTY,
        LEADING_DIGIT,
        TOO_LONG,
        INVALID_CHARACTER,
        RESERVED
    }

    private final Reason reason;
    private final String text;
    private final int index;

    public IdentifierException(Reason reason, String message, String text, int index) {
        super(ErrorKind.IDENTIFIER, message + ":\n" + text + "\n" + pointer(index));
        this.reason = reason;
        this.text = text;
        this.index = index;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * The offending name as given, trimmed.
     */
    public String getText() {
        return text;
    }

    /**
     * Index of the offending character within {@link #getText()}.
     */
    public int getIndex() {
        return index;
    }

    /**
     * Pointer line such as {@code ~~~^} marking {@link #getIndex()}.
     */
    public String getPointer() {
        return pointer(index);
    }

    @Override
    public int getPosition() {
        return index;
    }

    private static String pointer(int index) {
        return "~".repeat(Math.max(index, 0)) + "^";
    }
}
