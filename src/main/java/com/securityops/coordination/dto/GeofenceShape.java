package com.securityops.coordination.dto;

public enum GeofenceShape {
    CIRCLE,
    POLYGON
}
