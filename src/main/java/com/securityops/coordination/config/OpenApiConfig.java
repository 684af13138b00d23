package com.securityops.coordination.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for the REST surface.
 *
 * - Swagger UI: /swagger-ui.html
 * - OpenAPI JSON: /v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Value("${coordination.websocket.endpoint:/ws/coordination}")
    private String websocketEndpoint;

    @Bean
    public OpenAPI coordinationOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Location & Emergency-Alert Coordination API")
                        .description("Real-time agent positions, geofence violations and emergency alert escalation.\n\n" +
                                "## Flow\n\n" +
                                "1. Agent devices push location samples over STOMP (or the REST fallback)\n" +
                                "2. Samples are ordered per agent and tested against the shift's geofence\n" +
                                "3. Positions, violations and alerts are routed to rooms; offline recipients get them on reconnect\n" +
                                "4. Alerts escalate through timed tiers until acknowledged or resolved\n\n" +
                                "## WebSocket\n\n" +
                                "Connect to `" + websocketEndpoint + "` with an `Authorization` header on CONNECT.\n\n" +
                                "**Send to:**\n" +
                                "- `/app/location` - location sample\n" +
                                "- `/app/alert` - trigger an alert\n" +
                                "- `/app/alert/acknowledge`, `/app/alert/resolve` - alert actions\n" +
                                "- `/app/rooms` - `join:site:{siteId}`, `leave:monitoring`, ...\n" +
                                "- `/app/ping` - health check\n\n" +
                                "**Subscribe to:**\n" +
                                "- `/user/queue/events` - room events (LOCATION_UPDATE, GEOFENCE_VIOLATION, ALERT_*)\n" +
                                "- `/user/queue/reply` - command results\n" +
                                "- `/user/queue/errors` - rejected commands")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
