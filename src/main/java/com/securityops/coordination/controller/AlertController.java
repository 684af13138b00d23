package com.securityops.coordination.controller;

import com.securityops.coordination.dto.AcknowledgeRequest;
import com.securityops.coordination.dto.AlertEventRecord;
import com.securityops.coordination.dto.CreateAlertRequest;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.ResolveRequest;
import com.securityops.coordination.service.alert.AlertEscalationEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface of the alert engine, used by report-submission flows and the supervisor console.
 * Agent devices normally raise alerts over STOMP ({@code /app/alert}).
 */
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Emergency Alerts", description = "Raise, acknowledge and resolve emergency alerts")
public class AlertController {

    private final AlertEscalationEngine alertEngine;

    @Operation(
            summary = "Raise an emergency alert",
            description = "Opens an alert at escalation level 0 and notifies the level-0 rooms. " +
                    "PANIC, MEDICAL and FIRE alerts are always HIGH priority."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Alert created"),
            @ApiResponse(responseCode = "400", description = "Malformed request or unknown agent")
    })
    @PostMapping
    public ResponseEntity<EmergencyAlertView> createAlert(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Alert type, origin agent and optional site, location and description",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = CreateAlertRequest.class),
                            examples = @ExampleObject(
                                    value = "{\"type\":\"MEDICAL\",\"agentId\":\"AG-001\",\"siteId\":\"S1\"," +
                                            "\"location\":{\"latitude\":40.7128,\"longitude\":-74.0060}," +
                                            "\"description\":\"Visitor collapsed at gate B\"}"
                            )
                    )
            )
            @Valid @RequestBody CreateAlertRequest request) {
        log.info("Manual alert request: type={}, agent={}, site={}", request.type(), request.agentId(), request.siteId());
        EmergencyAlertView alert = alertEngine.createAlert(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(alert);
    }

    @Operation(
            summary = "Acknowledge an alert",
            description = "Stops escalation. Acknowledging an alert that is already acknowledged or resolved returns it unchanged."
    )
    @PostMapping("/{id}/acknowledge")
    public ResponseEntity<EmergencyAlertView> acknowledge(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @Valid @RequestBody AcknowledgeRequest request) {
        return ResponseEntity.ok(alertEngine.acknowledge(id, request.userId()));
    }

    @Operation(
            summary = "Resolve an alert",
            description = "Closes the alert as RESOLVED or FALSE_ALARM. Repeating the call returns the same record."
    )
    @PostMapping("/{id}/resolve")
    public ResponseEntity<EmergencyAlertView> resolve(
            @Parameter(description = "Alert ID") @PathVariable String id,
            @Valid @RequestBody ResolveRequest request) {
        return ResponseEntity.ok(alertEngine.resolve(id, request.userId(), request.notes(), request.outcomeOrDefault()));
    }

    @Operation(summary = "List unresolved alerts", description = "HIGH priority first, newest first within a priority.")
    @GetMapping("/active")
    public ResponseEntity<List<EmergencyAlertView>> activeAlerts() {
        return ResponseEntity.ok(alertEngine.activeAlerts());
    }

    @GetMapping("/{id}")
    public ResponseEntity<EmergencyAlertView> getAlert(@PathVariable String id) {
        return ResponseEntity.ok(alertEngine.getAlert(id));
    }

    /**
     * Audit trail of one alert, oldest transition first.
     */
    @Operation(summary = "Get the transition history of an alert")
    @GetMapping("/{id}/events")
    public ResponseEntity<List<AlertEventRecord>> alertEvents(@PathVariable String id) {
        return ResponseEntity.ok(alertEngine.alertHistory(id));
    }
}
