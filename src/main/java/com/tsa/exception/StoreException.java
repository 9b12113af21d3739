package com.tsa.exception;

/**
 * Exception thrown by the observation store: failed fetches, unknown sensors
 * or inconsistent interval data.
 */
public class StoreException extends TsaException {

    public StoreException(String message) {
        super(ErrorKind.STORE, message);
    }

    public StoreException(String message, Throwable cause) {
        super(ErrorKind.STORE, message, cause);
    }
}
