package com.tsa.exception;

/**
 * Exception thrown when a secondary block refers to a condition that does not
 * exist in the collection or that could not be evaluated.
 */
public class UnresolvedReferenceException extends TsaException {

    public UnresolvedReferenceException(String message) {
        super(ErrorKind.UNRESOLVED_REFERENCE, message);
    }
}
