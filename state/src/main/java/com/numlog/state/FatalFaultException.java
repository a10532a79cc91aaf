package com.numlog.state;

/**
 * An internal or environment fault the process must not continue past:
 * a failed append to the unique-values log, or a broken line reader.
 *
 * Client input errors never use this type.
 */
public final class FatalFaultException extends RuntimeException {

    public FatalFaultException(String message, Throwable cause) {
        super(message, cause);
    }

    public FatalFaultException(String message) {
        super(message);
    }
}
