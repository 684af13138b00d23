package com.securityops.coordination.dto;

public enum SampleStatus {
    ACTIVE,
    STALE
}
