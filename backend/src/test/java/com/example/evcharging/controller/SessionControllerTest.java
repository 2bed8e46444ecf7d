package com.example.evcharging.controller;

import com.example.evcharging.config.GlobalExceptionHandler;
import com.example.evcharging.config.IdentityProperties;
import com.example.evcharging.dto.PagedResponse;
import com.example.evcharging.dto.SessionStats;
import com.example.evcharging.exception.FailureReason;
import com.example.evcharging.exception.ProviderUnavailableException;
import com.example.evcharging.exception.SessionNotFoundException;
import com.example.evcharging.exception.SessionStartFailedException;
import com.example.evcharging.exception.SessionStopFailedException;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.service.ConfiguredTokenIdentityVerifier;
import com.example.evcharging.service.SessionOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class SessionControllerTest {

    private static final String TOKEN = "Bearer t-1";
    private static final String START_BODY =
            "{\"stationId\":\"st1\",\"chargerId\":\"c1\",\"provider\":\"chargepoint\",\"estimatedKwh\":30}";

    private SessionOrchestrator orchestrator;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        orchestrator = mock(SessionOrchestrator.class);
        IdentityProperties identity = new IdentityProperties();
        identity.setTokens(Map.of("t-1", "u1"));
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SessionController(orchestrator, new ConfiguredTokenIdentityVerifier(identity)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void startReturnsActiveSession() throws Exception {
        when(orchestrator.startSession("st1", "c1", "chargepoint", "u1", 30.0, null)).thenReturn(ChargingSession.builder()
                .sessionId("sess_1").provider("chargepoint").status(SessionStatus.ACTIVE).build());

        mockMvc.perform(post("/api/sessions/start")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(START_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sessionId").value("sess_1"))
                .andExpect(jsonPath("$.data.status").value("active"));
    }

    @Test
    void startPassesConnectorLabel() throws Exception {
        when(orchestrator.startSession("st1", "c1", "chargepoint", "u1", null, ConnectorType.TYPE2)).thenReturn(
                ChargingSession.builder().sessionId("sess_2").connectorType(ConnectorType.TYPE2).status(SessionStatus.ACTIVE).build());

        mockMvc.perform(post("/api/sessions/start")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stationId\":\"st1\",\"chargerId\":\"c1\",\"provider\":\"chargepoint\",\"connectorType\":\"type 2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.connectorType").value("Type2"));
    }

    @Test
    void unknownConnectorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/sessions/start")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stationId\":\"st1\",\"chargerId\":\"c1\",\"provider\":\"chargepoint\",\"connectorType\":\"J1772\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void startWithoutChargerIsValidationError() throws Exception {
        mockMvc.perform(post("/api/sessions/start")
                        .header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stationId\":\"st1\",\"provider\":\"chargepoint\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.chargerId").exists());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void startFailureStatusFollowsReason() throws Exception {
        when(orchestrator.startSession(anyString(), anyString(), anyString(), anyString(), any(), any()))
                .thenThrow(new SessionStartFailedException("chargepoint", FailureReason.REJECTED, "charger busy", null))
                .thenThrow(new SessionStartFailedException("chargepoint", FailureReason.UNAVAILABLE, "timeout", null));

        mockMvc.perform(post("/api/sessions/start").header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isConflict());
        mockMvc.perform(post("/api/sessions/start").header("Authorization", TOKEN)
                        .contentType(MediaType.APPLICATION_JSON).content(START_BODY))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void stoppingInactiveSessionIsConflict() throws Exception {
        when(orchestrator.stopSession("sess_1", "chargepoint", "u1"))
                .thenThrow(new SessionStopFailedException("chargepoint", FailureReason.NOT_ACTIVE, "Session sess_1 is not active"));

        mockMvc.perform(post("/api/sessions/sess_1/stop").header("Authorization", TOKEN).param("provider", "chargepoint"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Session sess_1 is not active"));
    }

    @Test
    void unavailableProviderOnStatusIs503() throws Exception {
        when(orchestrator.getSessionStatus("sess_1", "evgo", "u1"))
                .thenThrow(new ProviderUnavailableException("evgo", "Upstream unreachable"));

        mockMvc.perform(get("/api/sessions/sess_1/status").header("Authorization", TOKEN).param("provider", "evgo"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(orchestrator.getSession("ghost", null, "u1")).thenThrow(new SessionNotFoundException("ghost"));

        mockMvc.perform(get("/api/sessions/ghost").header("Authorization", TOKEN))
                .andExpect(status().isNotFound());
    }

    @Test
    void sessionLookupNarrowsByProvider() throws Exception {
        when(orchestrator.getSession("1001", "evgo", "u1")).thenReturn(
                ChargingSession.builder().sessionId("1001").provider("evgo").build());

        mockMvc.perform(get("/api/sessions/1001").header("Authorization", TOKEN).param("provider", "evgo"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.provider").value("evgo"));
    }

    @Test
    void statsSummaryIsReturned() throws Exception {
        when(orchestrator.getSessionStats("u1")).thenReturn(SessionStats.builder()
                .totalSessions(2)
                .totalEnergyKwh(50.5)
                .totalDurationHours(1.5)
                .averageSessionKwh(25.25)
                .favoriteStationId("st1")
                .mostUsedConnector(ConnectorType.CCS)
                .build());

        mockMvc.perform(get("/api/sessions/stats/summary").header("Authorization", TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalSessions").value(2))
                .andExpect(jsonPath("$.data.averageSessionKwh").value(25.25))
                .andExpect(jsonPath("$.data.mostUsedConnector").value("CCS"));
    }

    @Test
    void historyIsPaged() throws Exception {
        when(orchestrator.getSessionHistory("u1", 5, null)).thenReturn(
                PagedResponse.of(List.of(ChargingSession.builder().sessionId("old").build()), 5, 0));

        mockMvc.perform(get("/api/sessions/history").header("Authorization", TOKEN).param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.items[0].sessionId").value("old"));
    }

    @Test
    void unexpectedFailureIsGeneric500() throws Exception {
        when(orchestrator.getActiveSessions(eq("u1"))).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(get("/api/sessions/active").header("Authorization", TOKEN))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }

    @Test
    void wrongTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/sessions/active").header("Authorization", "Bearer nope"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(orchestrator);
    }
}
