package com.securityops.coordination.exception;

public class AlertNotFoundException extends CoordinationException {

    public AlertNotFoundException(String message) {
        super(message);
    }
}
