package com.securityops.coordination.dto;

/**
 * Last known position of an agent as seen by a supervisor UI or the polling endpoint.
 * {@code status} is computed at read time against the freshness window.
 */
public record LatestLocationView(
    LocationSample sample,
    SampleStatus status,
    long ageSeconds
) {
}
