package com.securityops.coordination.controller;

import com.securityops.coordination.dto.Acknowledgment;
import com.securityops.coordination.dto.AlertPriority;
import com.securityops.coordination.dto.AlertSource;
import com.securityops.coordination.dto.AlertStatus;
import com.securityops.coordination.dto.AlertType;
import com.securityops.coordination.dto.CreateAlertRequest;
import com.securityops.coordination.dto.EmergencyAlertView;
import com.securityops.coordination.dto.GeoPoint;
import com.securityops.coordination.dto.Resolution;
import com.securityops.coordination.dto.ResolutionOutcome;
import com.securityops.coordination.exception.AlertNotFoundException;
import com.securityops.coordination.exception.ValidationException;
import com.securityops.coordination.service.alert.AlertEscalationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    private static final Instant CREATED = Instant.parse("2024-06-03T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertEscalationEngine alertEngine;

    @Test
    void createReturns201WithTheOpenAlert() throws Exception {
        when(alertEngine.createAlert(any(CreateAlertRequest.class))).thenReturn(openAlert("A-1"));

        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"MEDICAL\",\"agentId\":\"AG-1\",\"siteId\":\"S1\"," +
                                "\"location\":{\"latitude\":40.0,\"longitude\":29.0}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("A-1"))
                .andExpect(jsonPath("$.status").value("OPEN"))
                .andExpect(jsonPath("$.priority").value("HIGH"))
                .andExpect(jsonPath("$.escalationLevel").value(0));
    }

    @Test
    void createWithoutTypeIsRejected() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agentId\":\"AG-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Alert type is required"));

        verify(alertEngine, never()).createAlert(any());
    }

    @Test
    void createWithOutOfRangeLocationIsRejected() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"PANIC\",\"agentId\":\"AG-1\"," +
                                "\"location\":{\"latitude\":95.0,\"longitude\":29.0}}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownAgentIsABadRequest() throws Exception {
        when(alertEngine.createAlert(any(CreateAlertRequest.class)))
                .thenThrow(new ValidationException("Unknown agent: AG-404"));

        mockMvc.perform(post("/api/alerts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"SECURITY\",\"agentId\":\"AG-404\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown agent: AG-404"));
    }

    @Test
    void acknowledgeDelegatesToTheEngine() throws Exception {
        EmergencyAlertView acked = withStatus(openAlert("A-1"), AlertStatus.ACKNOWLEDGED,
                List.of(new Acknowledgment("u-sup", CREATED.plusSeconds(30))), null);
        when(alertEngine.acknowledge("A-1", "u-sup")).thenReturn(acked);

        mockMvc.perform(post("/api/alerts/A-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u-sup\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACKNOWLEDGED"))
                .andExpect(jsonPath("$.acknowledgments[0].userId").value("u-sup"));
    }

    @Test
    void acknowledgeWithoutUserIsRejected() throws Exception {
        mockMvc.perform(post("/api/alerts/A-1/acknowledge")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resolveDefaultsToResolvedOutcome() throws Exception {
        Resolution resolution = new Resolution("u-sup", CREATED.plusSeconds(90), null, ResolutionOutcome.RESOLVED);
        when(alertEngine.resolve("A-1", "u-sup", null, ResolutionOutcome.RESOLVED))
                .thenReturn(withStatus(openAlert("A-1"), AlertStatus.RESOLVED, List.of(), resolution));

        mockMvc.perform(post("/api/alerts/A-1/resolve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"u-sup\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolution.outcome").value("RESOLVED"));

        verify(alertEngine).resolve(eq("A-1"), eq("u-sup"), isNull(), eq(ResolutionOutcome.RESOLVED));
    }

    @Test
    void unknownAlertIs404() throws Exception {
        when(alertEngine.getAlert("nope")).thenThrow(new AlertNotFoundException("nope"));

        mockMvc.perform(get("/api/alerts/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void activeAlertsAreListed() throws Exception {
        when(alertEngine.activeAlerts()).thenReturn(List.of(openAlert("A-2"), openAlert("A-1")));

        mockMvc.perform(get("/api/alerts/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value("A-2"));
    }

    private static EmergencyAlertView openAlert(String id) {
        return new EmergencyAlertView(id, AlertType.MEDICAL, AlertPriority.HIGH, AlertSource.AGENT_TRIGGER,
                "AG-1", "S1", new GeoPoint(40.0, 29.0, null), null, AlertStatus.OPEN, 0,
                List.of(), null, CREATED, CREATED, 1);
    }

    private static EmergencyAlertView withStatus(EmergencyAlertView alert, AlertStatus status,
                                                 List<Acknowledgment> acknowledgments, Resolution resolution) {
        return new EmergencyAlertView(alert.id(), alert.type(), alert.priority(), alert.source(),
                alert.agentId(), alert.siteId(), alert.location(), alert.description(), status,
                alert.escalationLevel(), acknowledgments, resolution, alert.createdAt(), CREATED.plusSeconds(90),
                alert.version() + 1);
    }
}
