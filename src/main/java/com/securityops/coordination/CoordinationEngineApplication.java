package com.securityops.coordination;

import com.securityops.coordination.config.CoordinationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the real-time location and emergency-alert coordination engine.
 *
 * Flow:
 * 1. Agents connect over STOMP and push location samples
 * 2. Samples are validated, ordered per agent and tested against the shift's geofence
 * 3. Positions and violations are fanned out to supervisor rooms, queued for offline recipients
 * 4. Emergency alerts escalate through timed tiers until acknowledged or resolved
 * 5. Every sample and alert transition is written asynchronously to the audit store
 *
 * - @EnableScheduling: escalation timers, idle-session sweeps, queue purges and cache refreshes
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(CoordinationProperties.class)
public class CoordinationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoordinationEngineApplication.class, args);
    }
}
