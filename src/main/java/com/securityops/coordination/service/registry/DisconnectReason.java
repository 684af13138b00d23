package com.securityops.coordination.service.registry;

public enum DisconnectReason {
    EXPLICIT,
    IDLE_TIMEOUT
}
