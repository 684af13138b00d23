package com.securityops.coordination.exception;

/**
 * Malformed sample or unknown agent/site; returned synchronously to the originating connection.
 */
public class ValidationException extends CoordinationException {

    public ValidationException(String message) {
        super(message);
    }
}
