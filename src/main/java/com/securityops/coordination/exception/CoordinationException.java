package com.securityops.coordination.exception;

/**
 * Base of every error raised by the coordination engine.
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
