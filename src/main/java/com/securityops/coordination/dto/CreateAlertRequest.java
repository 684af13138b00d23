package com.securityops.coordination.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request to raise an emergency alert, either from an agent's device or from a report-submission flow.
 *
 * @param siteId   Optional; resolved from the agent's active shift when absent
 * @param priority Optional override for non life-safety types
 * @param source   Optional; defaults to MANUAL_REPORT
 */
public record CreateAlertRequest(
    @NotNull(message = "Alert type is required")
    AlertType type,

    @NotBlank(message = "Agent ID cannot be blank")
    String agentId,

    String siteId,

    @Valid
    GeoPoint location,

    @Size(max = 2000, message = "Description must be at most 2000 characters")
    String description,

    AlertPriority priority,

    AlertSource source
) {

    public AlertSource sourceOrDefault() {
        return source == null ? AlertSource.MANUAL_REPORT : source;
    }
}
