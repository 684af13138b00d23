package com.securityops.coordination.exception;

/**
 * Out-of-order sample. Dropped with a debug log, never surfaced to the client as a failure.
 */
public class StaleDataException extends CoordinationException {

    public StaleDataException(String message) {
        super(message);
    }
}
