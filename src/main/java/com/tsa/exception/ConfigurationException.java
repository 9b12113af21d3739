package com.tsa.exception;

/**
 * Exception thrown when the analysis configuration is invalid.
 * Results in fail-fast at startup.
 */
public class ConfigurationException extends TsaException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
