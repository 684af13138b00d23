package com.securityops.coordination.exception;

/**
 * Audit write failed. Retried with backoff, never blocks the live path.
 */
public class PersistenceException extends CoordinationException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
