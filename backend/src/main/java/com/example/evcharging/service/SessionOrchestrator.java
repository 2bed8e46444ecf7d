package com.example.evcharging.service;

import com.example.evcharging.dto.PagedResponse;
import com.example.evcharging.dto.SessionStats;
import com.example.evcharging.exception.ClientException;
import com.example.evcharging.exception.FailureReason;
import com.example.evcharging.exception.ProviderException;
import com.example.evcharging.exception.SessionNotFoundException;
import com.example.evcharging.exception.SessionStartFailedException;
import com.example.evcharging.exception.SessionStopFailedException;
import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.Notification;
import com.example.evcharging.model.SessionState;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.store.StoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Drives a charging session through Starting, Active, Stopping and a terminal state.
 * <p>
 * The provider is authoritative for whether a session exists. The store is written only
 * after the provider confirmed a transition; when that write fails the provider's answer
 * still wins and the divergence is logged for reconciliation. Transitions in flight are
 * tracked in memory only to reject a duplicate start or stop, never held across the
 * provider call as a lock on the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionOrchestrator {

    public static final int DEFAULT_HISTORY_LIMIT = 20;
    public static final int MAX_HISTORY_LIMIT = 100;

    private final ProviderAggregator aggregator;
    private final LiveStateService liveState;

    private final ConcurrentMap<String, SessionState> transitions = new ConcurrentHashMap<>();

    /* ---------- start ---------- */

    public ChargingSession startSession(String stationId, String chargerId, String providerId,
                                        String userId, Double estimatedKwh) {
        return startSession(stationId, chargerId, providerId, userId, estimatedKwh, null);
    }

    /**
     * @param connectorType connector the driver plugs in, when known; kept on the record for usage stats
     */
    public ChargingSession startSession(String stationId, String chargerId, String providerId,
                                        String userId, Double estimatedKwh, ConnectorType connectorType) {
        aggregator.requireProvider(providerId);

        String chargerKey = providerId + ":" + stationId + ":" + chargerId;
        if (transitions.putIfAbsent(chargerKey, SessionState.STARTING) != null) {
            throw new SessionStartFailedException(providerId, FailureReason.REJECTED,
                    "A session start is already in progress on charger " + chargerId, null);
        }
        try {
            ChargingSession reported;
            try {
                reported = aggregator.startSession(stationId, chargerId, providerId, userId);
            } catch (ProviderException e) {
                log.warn("Start on {} {}/{} failed ({}): {}", providerId, stationId, chargerId, e.getReason(), e.getMessage());
                throw new SessionStartFailedException(providerId, e.getReason(),
                        "Provider " + providerId + " could not start the session: " + e.getMessage(), e);
            }
            if (reported.getStatus() != null && reported.getStatus().isTerminal()) {
                log.warn("Provider {} answered start of {}/{} with status {}", providerId, stationId, chargerId, reported.getStatus());
                throw new SessionStartFailedException(providerId, FailureReason.REJECTED,
                        "Provider " + providerId + " reported the session as " + reported.getStatus().getValue(), null);
            }

            ChargingSession session = reported.toBuilder()
                    .userId(userId)
                    .stationId(stationId)
                    .chargerId(chargerId)
                    .provider(providerId)
                    .status(SessionStatus.ACTIVE)
                    .startedAt(reported.getStartedAt() != null ? reported.getStartedAt() : Instant.now())
                    .estimatedKwh(estimatedKwh)
                    .connectorType(connectorType != null ? connectorType : reported.getConnectorType())
                    .build();
            recordStart(session);
            log.info("Session {} started on {} {}/{} for user {}", session.getSessionId(), providerId, stationId, chargerId, userId);
            return session;
        } finally {
            transitions.remove(chargerKey);
        }
    }

    private void recordStart(ChargingSession session) {
        try {
            if (!liveState.createSession(session)) {
                log.warn("RECONCILE session {} started at provider {} for user {} collides with another user's record",
                        session.getSessionId(), session.getProvider(), session.getUserId());
            }
            liveState.updateChargerAvailability(session.getStationId(), session.getChargerId(), false, null);
            if (session.getUserId() != null) {
                liveState.sendNotification(session.getUserId(), Notification.builder()
                        .type("session_started")
                        .title("Charging Started")
                        .message("Your charging session at station " + session.getStationId() + " has started")
                        .sessionId(session.getSessionId())
                        .build());
            }
            liveState.logEvent("session_started", sessionEvent(session));
        } catch (StoreException e) {
            log.warn("RECONCILE session {} is active at provider {} but the store write failed: {}",
                    session.getSessionId(), session.getProvider(), e.getMessage());
        }
    }

    /* ---------- stop ---------- */

    public ChargingSession stopSession(String sessionId, String providerId, String userId) {
        aggregator.requireProvider(providerId);

        Optional<ChargingSession> record = liveState.findLiveSession(providerId, sessionId);
        if (record.isPresent()) {
            ChargingSession stored = record.get();
            checkOwner(stored, userId);
            if (stored.getStatus() != SessionStatus.ACTIVE) {
                throw notActive(providerId, sessionId);
            }
        } else {
            requireActiveAtProvider(sessionId, providerId, userId);
        }

        String sessionKey = LiveStateService.sessionKey(providerId, sessionId);
        if (transitions.putIfAbsent(sessionKey, SessionState.STOPPING) != null) {
            throw new SessionStopFailedException(providerId, FailureReason.REJECTED,
                    "A stop is already in progress for session " + sessionId);
        }
        try {
            ChargingSession report;
            try {
                report = aggregator.stopSession(sessionId, providerId);
            } catch (ProviderException e) {
                log.warn("Stop of session {} on {} failed ({}): {}", sessionId, providerId, e.getReason(), e.getMessage());
                throw new SessionStopFailedException(providerId, e.getReason(),
                        "Provider " + providerId + " could not stop the session: " + e.getMessage(), e);
            }
            SessionStatus terminal = report.getStatus() == SessionStatus.FAILED ? SessionStatus.FAILED : SessionStatus.COMPLETED;
            ChargingSession finished = recordStop(providerId, sessionId, report, terminal)
                    .orElseGet(() -> report.toBuilder()
                            .sessionId(sessionId)
                            .provider(providerId)
                            .userId(record.map(ChargingSession::getUserId).orElse(userId))
                            .status(terminal)
                            .endedAt(report.getEndedAt() != null ? report.getEndedAt() : Instant.now())
                            .build());
            log.info("Session {} on {} ended as {}: {} kWh in {} min", sessionId, providerId, terminal.getValue(),
                    finished.getEnergyDeliveredKwh(), finished.getDurationMinutes());
            return finished;
        } finally {
            transitions.remove(sessionKey);
        }
    }

    /**
     * Without a live record the provider decides whether there is anything to stop.
     */
    private void requireActiveAtProvider(String sessionId, String providerId, String userId) {
        Optional<ChargingSession> archived = liveState.getSession(providerId, sessionId);
        if (archived.isPresent()) {
            checkOwner(archived.get(), userId);
            throw notActive(providerId, sessionId);
        }
        Optional<ChargingSession> upstream;
        try {
            upstream = aggregator.getSessionStatus(sessionId, providerId);
        } catch (ProviderException e) {
            throw new SessionStopFailedException(providerId, e.getReason(),
                    "Provider " + providerId + " could not confirm session " + sessionId + ": " + e.getMessage(), e);
        }
        ChargingSession status = upstream.orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (status.getStatus() != SessionStatus.ACTIVE) {
            throw notActive(providerId, sessionId);
        }
    }

    private Optional<ChargingSession> recordStop(String providerId, String sessionId, ChargingSession report,
                                                 SessionStatus terminal) {
        try {
            Optional<ChargingSession> finished = liveState.endSession(providerId, sessionId, report, terminal);
            if (finished.isEmpty()) {
                log.warn("RECONCILE session {} stopped at provider {} without a live record", sessionId, providerId);
                return finished;
            }
            ChargingSession session = finished.get();
            if (session.getUserId() != null) {
                liveState.sendNotification(session.getUserId(), Notification.builder()
                        .type("session_completed")
                        .title("Charging Complete")
                        .message(String.format("Session complete: %s kWh delivered in %s minutes",
                                session.getEnergyDeliveredKwh(), session.getDurationMinutes()))
                        .sessionId(sessionId)
                        .build());
            }
            liveState.logEvent("session_" + terminal.getValue(), sessionEvent(session));
            return finished;
        } catch (StoreException e) {
            log.warn("RECONCILE session {} stopped at provider {} but the store write failed: {}",
                    sessionId, providerId, e.getMessage());
            return Optional.empty();
        }
    }

    /* ---------- status & queries ---------- */

    /**
     * The provider's view of a session. A stored record that disagrees with it is brought in
     * line: a terminal report closes an active record, an active report recreates a missing one.
     */
    public ChargingSession getSessionStatus(String sessionId, String providerId, String userId) {
        aggregator.requireProvider(providerId);
        Optional<ChargingSession> stored = liveState.getSession(providerId, sessionId);
        stored.ifPresent(session -> checkOwner(session, userId));

        ChargingSession report = aggregator.getSessionStatus(sessionId, providerId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        ChargingSession.ChargingSessionBuilder view = report.toBuilder().sessionId(sessionId).provider(providerId);
        stored.ifPresent(session -> view
                .userId(session.getUserId())
                .stationId(report.getStationId() != null ? report.getStationId() : session.getStationId())
                .chargerId(report.getChargerId() != null ? report.getChargerId() : session.getChargerId())
                .startedAt(report.getStartedAt() != null ? report.getStartedAt() : session.getStartedAt())
                .estimatedKwh(session.getEstimatedKwh()));
        if (stored.isEmpty()) {
            view.userId(userId);
        }
        ChargingSession live = view.build();
        reconcile(stored.orElse(null), live);
        return live;
    }

    private void reconcile(ChargingSession stored, ChargingSession live) {
        if (live.getStatus() == null
                || transitions.containsKey(LiveStateService.sessionKey(live.getProvider(), live.getSessionId()))) {
            return;
        }
        try {
            if (stored != null && stored.getStatus() == SessionStatus.ACTIVE && live.getStatus().isTerminal()) {
                log.info("Session {} ended at provider {} without a stop request, closing record as {}",
                        live.getSessionId(), live.getProvider(), live.getStatus().getValue());
                recordStop(live.getProvider(), live.getSessionId(), live, live.getStatus());
            } else if (stored == null && live.getStatus() == SessionStatus.ACTIVE) {
                log.warn("RECONCILE session {} active at provider {} had no record, recreating it",
                        live.getSessionId(), live.getProvider());
                liveState.createSession(live.toBuilder()
                        .startedAt(live.getStartedAt() != null ? live.getStartedAt() : Instant.now())
                        .build());
            }
        } catch (StoreException e) {
            log.warn("RECONCILE session {} could not be aligned with provider {}: {}",
                    live.getSessionId(), live.getProvider(), e.getMessage());
        }
    }

    /**
     * Active sessions of a user, refreshed with live provider figures where the provider answers.
     */
    public List<ChargingSession> getActiveSessions(String userId) {
        List<ChargingSession> active = new ArrayList<>();
        for (ChargingSession stored : liveState.getActiveSessions(userId)) {
            ChargingSession refreshed = refresh(stored);
            if (refreshed.getStatus() == SessionStatus.ACTIVE) {
                active.add(refreshed);
            }
        }
        return active;
    }

    private ChargingSession refresh(ChargingSession stored) {
        if (stored.getProvider() == null) {
            return stored;
        }
        Optional<ChargingSession> report;
        try {
            report = aggregator.getSessionStatus(stored.getSessionId(), stored.getProvider());
        } catch (ProviderException | ClientException e) {
            log.debug("Keeping stored view of session {}: {}", stored.getSessionId(), e.getMessage());
            return stored;
        }
        if (report.isEmpty() || report.get().getStatus() == null) {
            return stored;
        }
        ChargingSession live = report.get();
        ChargingSession merged = stored.toBuilder()
                .status(live.getStatus())
                .energyDeliveredKwh(live.getEnergyDeliveredKwh() != null ? live.getEnergyDeliveredKwh() : stored.getEnergyDeliveredKwh())
                .durationMinutes(live.getDurationMinutes() != null ? live.getDurationMinutes() : stored.getDurationMinutes())
                .currentPowerKw(live.getCurrentPowerKw())
                .endedAt(live.getEndedAt())
                .build();
        reconcile(stored, merged);
        return merged;
    }

    public PagedResponse<ChargingSession> getSessionHistory(String userId, Integer limit, Integer offset) {
        int pageSize = limit == null ? DEFAULT_HISTORY_LIMIT : Math.max(1, Math.min(MAX_HISTORY_LIMIT, limit));
        int from = offset == null ? 0 : offset;
        if (from < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return PagedResponse.of(liveState.getSessionHistory(userId), pageSize, from);
    }

    /**
     * Usage totals over the user's finished sessions.
     */
    public SessionStats getSessionStats(String userId) {
        List<ChargingSession> history = liveState.getSessionHistory(userId);
        double energy = 0;
        long minutes = 0;
        Map<String, Integer> stations = new LinkedHashMap<>();
        Map<ConnectorType, Integer> connectors = new LinkedHashMap<>();
        for (ChargingSession session : history) {
            if (session.getEnergyDeliveredKwh() != null) {
                energy += session.getEnergyDeliveredKwh();
            }
            if (session.getDurationMinutes() != null) {
                minutes += session.getDurationMinutes();
            }
            if (session.getStationId() != null) {
                stations.merge(session.getStationId(), 1, Integer::sum);
            }
            if (session.getConnectorType() != null) {
                connectors.merge(session.getConnectorType(), 1, Integer::sum);
            }
        }
        return SessionStats.builder()
                .totalSessions(history.size())
                .totalEnergyKwh(round(energy))
                .totalDurationHours(round(minutes / 60.0))
                .averageSessionKwh(history.isEmpty() ? 0.0 : round(energy / history.size()))
                .favoriteStationId(mostFrequent(stations))
                .mostUsedConnector(mostFrequent(connectors))
                .build();
    }

    /** Ties go to the key seen first. */
    private static <K> K mostFrequent(Map<K, Integer> counts) {
        K best = null;
        int bestCount = 0;
        for (Map.Entry<K, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Stored record of a session. Without a provider the id is looked up across providers
     * and must identify a single record visible to the caller.
     */
    public ChargingSession getSession(String sessionId, String providerId, String userId) {
        if (providerId != null) {
            ChargingSession session = liveState.getSession(providerId, sessionId)
                    .orElseThrow(() -> new SessionNotFoundException(sessionId));
            checkOwner(session, userId);
            return session;
        }
        List<ChargingSession> visible = liveState.findSessions(sessionId).stream()
                .filter(session -> isVisibleTo(session, userId))
                .toList();
        if (visible.isEmpty()) {
            throw new SessionNotFoundException(sessionId);
        }
        if (visible.size() > 1) {
            throw new IllegalArgumentException("Session id " + sessionId + " is used by several providers, pass the provider");
        }
        return visible.get(0);
    }

    /* ---------- helpers ---------- */

    /** Other users' sessions are reported as missing. */
    private static void checkOwner(ChargingSession session, String userId) {
        if (!isVisibleTo(session, userId)) {
            throw new SessionNotFoundException(session.getSessionId());
        }
    }

    private static boolean isVisibleTo(ChargingSession session, String userId) {
        return userId == null || session.getUserId() == null || Objects.equals(session.getUserId(), userId);
    }

    private static SessionStopFailedException notActive(String providerId, String sessionId) {
        return new SessionStopFailedException(providerId, FailureReason.NOT_ACTIVE, "Session " + sessionId + " is not active");
    }

    private static Map<String, Object> sessionEvent(ChargingSession session) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("session_id", session.getSessionId());
        event.put("provider", session.getProvider());
        event.put("station_id", session.getStationId());
        event.put("charger_id", session.getChargerId());
        if (session.getConnectorType() != null) {
            event.put("connector_type", session.getConnectorType().getLabel());
        }
        if (session.getUserId() != null) {
            event.put("user_id", session.getUserId());
        }
        if (session.getEnergyDeliveredKwh() != null) {
            event.put("energy_kwh", session.getEnergyDeliveredKwh());
        }
        if (session.getDurationMinutes() != null) {
            event.put("duration_minutes", session.getDurationMinutes());
        }
        return event;
    }
}
