package com.securityops.coordination.exception;

/**
 * Bad or expired session token; the connection is refused.
 */
public class AuthenticationException extends CoordinationException {

    public AuthenticationException(String message) {
        super(message);
    }
}
