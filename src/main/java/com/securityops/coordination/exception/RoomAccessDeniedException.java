package com.securityops.coordination.exception;

public class RoomAccessDeniedException extends CoordinationException {

    public RoomAccessDeniedException(String message) {
        super(message);
    }
}
