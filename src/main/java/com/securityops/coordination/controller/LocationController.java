package com.securityops.coordination.controller;

import com.securityops.coordination.dto.IngestResult;
import com.securityops.coordination.dto.LatestLocationView;
import com.securityops.coordination.dto.LocationSample;
import com.securityops.coordination.dto.LocationSampleRecord;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.location.LocationIngestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * REST fallback for devices that cannot hold a WebSocket, plus the polling views of agent positions.
 *
 * Example:
 * POST /api/locations/AG-001
 * {
 *   "latitude": 40.7128,
 *   "longitude": -74.0060,
 *   "accuracy": 8.5,
 *   "timestamp": 1717430400000
 * }
 */
@RestController
@RequestMapping("/api/locations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Locations", description = "Agent location ingest and last known positions")
public class LocationController {

    private static final Duration DEFAULT_HISTORY_WINDOW = Duration.ofHours(24);

    private final LocationIngestService ingestService;
    private final Clock clock;

    @Operation(
            summary = "Ingest a location sample",
            description = "Runs the same pipeline as the STOMP /app/location destination. " +
                    "Rejected samples (no active shift, poor accuracy, out of order) are reported in the body, not as errors."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Sample processed",
                    content = @Content(
                            mediaType = "application/json",
                            examples = {
                                    @ExampleObject(
                                            name = "Rejected",
                                            value = "{\"accepted\":false,\"rejectionReason\":\"ACCURACY_TOO_LOW\",\"sample\":null,\"violation\":null}"
                                    )
                            }
                    )
            ),
            @ApiResponse(responseCode = "400", description = "Malformed sample, future timestamp or unknown agent")
    })
    @PostMapping("/{agentId}")
    public ResponseEntity<IngestResult> ingest(
            @Parameter(description = "Agent ID", example = "AG-001") @PathVariable String agentId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "GPS reading with capture timestamp in epoch milliseconds",
                    required = true,
                    content = @Content(schema = @Schema(implementation = LocationSampleRecord.class))
            )
            @RequestBody LocationSampleRecord sample) {
        log.debug("REST location sample from {}: {}", agentId, sample == null ? null : sample.toLogString());
        return ResponseEntity.ok(ingestService.ingest(agentId, sample));
    }

    @Operation(
            summary = "Last known positions",
            description = "All agents of a site when siteId is given, otherwise every agent with a recent position."
    )
    @GetMapping("/latest")
    public ResponseEntity<List<LatestLocationView>> latest(
            @Parameter(description = "Site ID", example = "S1") @RequestParam(required = false) String siteId) {
        List<LatestLocationView> positions = siteId == null || siteId.isBlank()
                ? ingestService.latestAll()
                : ingestService.latestForSite(siteId);
        return ResponseEntity.ok(positions);
    }

    @GetMapping("/latest/{agentId}")
    public ResponseEntity<LatestLocationView> latestForAgent(@PathVariable String agentId) {
        return ingestService.latestFor(agentId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(
            summary = "Stored track of an agent",
            description = "Samples between from and to (ISO-8601), oldest first. Defaults to the last 24 hours."
    )
    @GetMapping("/history/{agentId}")
    public ResponseEntity<List<LocationSample>> history(
            @PathVariable String agentId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        if (agentId.isBlank()) {
            throw new ValidationException("Agent ID is required");
        }
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_HISTORY_WINDOW);
        return ResponseEntity.ok(ingestService.history(agentId, start, end));
    }
}
