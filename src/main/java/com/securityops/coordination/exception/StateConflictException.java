package com.securityops.coordination.exception;

/**
 * Transition attempted on an alert in a terminal state; callers get the existing state instead.
 */
public class StateConflictException extends CoordinationException {

    public StateConflictException(String message) {
        super(message);
    }
}
