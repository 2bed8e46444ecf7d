package com.example.evcharging.controller;

import com.example.evcharging.dto.ApiResponse;
import com.example.evcharging.dto.PagedResponse;
import com.example.evcharging.dto.SessionStats;
import com.example.evcharging.dto.StartSessionRequest;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.service.IdentityVerifier;
import com.example.evcharging.service.SessionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/sessions")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
@Tag(name = "sessions", description = "Charging session lifecycle")
public class SessionController {

    private final SessionOrchestrator orchestrator;
    private final IdentityVerifier identityVerifier;

    @PostMapping("/start")
    @Operation(summary = "Start charging on a charger")
    public ResponseEntity<ApiResponse<ChargingSession>> start(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @Valid @RequestBody StartSessionRequest request) {
        String userId = identityVerifier.verify(authorization);
        ChargingSession session = orchestrator.startSession(request.getStationId(), request.getChargerId(),
                request.getProvider(), userId, request.getEstimatedKwh(), parseConnector(request.getConnectorType()));
        return ResponseEntity.ok(ApiResponse.success("Charging session started", session));
    }

    @PostMapping("/{sessionId}/stop")
    @Operation(summary = "Stop an active session")
    public ResponseEntity<ApiResponse<ChargingSession>> stop(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String sessionId,
            @RequestParam String provider) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success("Charging session stopped",
                orchestrator.stopSession(sessionId, provider, userId)));
    }

    @GetMapping("/{sessionId}/status")
    @Operation(summary = "Live status of a session as reported by its provider")
    public ResponseEntity<ApiResponse<ChargingSession>> status(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String sessionId,
            @RequestParam String provider) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getSessionStatus(sessionId, provider, userId)));
    }

    @GetMapping("/active")
    @Operation(summary = "Active sessions of the caller")
    public ResponseEntity<ApiResponse<List<ChargingSession>>> active(
            @RequestHeader(value = "Authorization", required = false) String authorization) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getActiveSessions(userId)));
    }

    @GetMapping("/history")
    @Operation(summary = "Finished sessions of the caller, newest first")
    public ResponseEntity<ApiResponse<PagedResponse<ChargingSession>>> history(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getSessionHistory(userId, limit, offset)));
    }

    @GetMapping("/stats/summary")
    @Operation(summary = "Charging totals of the caller over finished sessions")
    public ResponseEntity<ApiResponse<SessionStats>> stats(
            @RequestHeader(value = "Authorization", required = false) String authorization) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getSessionStats(userId)));
    }

    @GetMapping("/{sessionId}")
    @Operation(summary = "Stored record of a session, active or finished")
    public ResponseEntity<ApiResponse<ChargingSession>> get(
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @PathVariable String sessionId,
            @RequestParam(required = false) String provider) {
        String userId = identityVerifier.verify(authorization);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getSession(sessionId, provider, userId)));
    }

    private static ConnectorType parseConnector(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ConnectorType.lookup(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown connector type: " + value));
    }
}
