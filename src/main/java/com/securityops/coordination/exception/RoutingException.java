package com.securityops.coordination.exception;

/**
 * Room has no known recipients. Logged, not fatal.
 */
public class RoutingException extends CoordinationException {

    public RoutingException(String message) {
        super(message);
    }
}
