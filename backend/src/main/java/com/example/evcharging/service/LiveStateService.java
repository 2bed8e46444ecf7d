package com.example.evcharging.service;

import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.Notification;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.model.StationAvailability;
import com.example.evcharging.store.RealtimeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Station, session and user documents in the realtime store.
 * <p>
 * Layout:
 * <pre>
 * stations/{stationId}/status                            availability summary
 * stations/{stationId}/chargers/{chargerId}              per-charger availability
 * sessions/{provider}:{sessionId}                        live session record
 * sessions_history/{provider}:{sessionId}                archived copy of a finished session
 * users/{userId}/active_sessions/{provider}:{sessionId}  active-session index
 * users/{userId}/notifications/{pushKey}                 notification list
 * analytics/{eventType}/{pushKey}                        analytics events
 * </pre>
 * Every write is a small, field-scoped update so unrelated writers never overwrite each other.
 * Store failures propagate as {@link com.example.evcharging.store.StoreException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveStateService {

    private final RealtimeStore store;

    /* ---------- stations ---------- */

    public Optional<StationAvailability> getStationStatus(String stationId) {
        return store.get(stationStatusPath(stationId)).map(LiveStateService::toAvailability);
    }

    public void updateStationStatus(String stationId, StationAvailability availability) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("available_chargers", availability.getAvailableChargers());
        doc.put("total_chargers", availability.getTotalChargers());
        doc.put("operational", availability.isOperational());
        doc.put("last_updated", Instant.now().toString());
        store.set(stationStatusPath(stationId), doc);
    }

    /** Charger id to live availability for every charger the store knows at this station. */
    public Map<String, Boolean> getChargerAvailability(String stationId) {
        Map<String, Boolean> result = new LinkedHashMap<>();
        store.children(chargersPath(stationId)).forEach((chargerId, doc) ->
                result.put(chargerId, Boolean.TRUE.equals(doc.get("available"))));
        return result;
    }

    /**
     * Updates one charger and recomputes the station summary from the chargers the store knows.
     */
    public StationAvailability updateChargerAvailability(String stationId, String chargerId,
                                                         boolean available, Double powerKw) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("available", available);
        if (powerKw != null) {
            fields.put("power_kw", powerKw);
        }
        fields.put("last_updated", Instant.now().toString());
        store.update(chargersPath(stationId) + "/" + chargerId, fields);

        Map<String, Boolean> chargers = getChargerAvailability(stationId);
        int availableCount = (int) chargers.values().stream().filter(Boolean::booleanValue).count();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("available_chargers", availableCount);
        summary.put("total_chargers", chargers.size());
        summary.put("operational", availableCount > 0);
        summary.put("last_updated", Instant.now().toString());
        return toAvailability(store.update(stationStatusPath(stationId), summary));
    }

    /* ---------- sessions ---------- */

    /**
     * Writes the session record and the owner's active-session index entry. A record that
     * already exists for the same owner is updated in place; one owned by another user is
     * left untouched.
     *
     * @return false when an existing record belongs to another user and nothing was written
     */
    public boolean createSession(ChargingSession session) {
        String key = sessionKey(session.getProvider(), session.getSessionId());
        String path = sessionPath(session.getProvider(), session.getSessionId());
        Map<String, Object> doc = toDocument(session);
        doc.put("created_at", Instant.now().toString());
        if (!store.setIfAbsent(path, doc)) {
            Object owner = store.get(path).map(existing -> existing.get("user_id")).orElse(null);
            if (owner != null && session.getUserId() != null && !owner.equals(session.getUserId())) {
                log.warn("Session {} is already recorded for another user, not overwriting", key);
                return false;
            }
            log.warn("Session {} already present in store, updating", key);
            doc.remove("created_at");
            store.update(path, doc);
        }
        if (session.getUserId() != null) {
            Map<String, Object> index = new LinkedHashMap<>();
            index.put("active", true);
            index.put("provider", session.getProvider());
            index.put("session_id", session.getSessionId());
            store.set(activeIndexPath(session.getUserId()) + "/" + key, index);
        }
        return true;
    }

    /**
     * Applies the provider's terminal report, removes the owner's active index entry and
     * copies the record into the archive.
     *
     * @return the finished record, or empty when there is no live record for the session
     */
    public Optional<ChargingSession> endSession(String providerId, String sessionId, ChargingSession report,
                                                SessionStatus terminalStatus) {
        String path = sessionPath(providerId, sessionId);
        if (store.get(path).isEmpty()) {
            return Optional.empty();
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("status", terminalStatus.getValue());
        Instant endedAt = report.getEndedAt() != null ? report.getEndedAt() : Instant.now();
        fields.put("ended_at", endedAt.toString());
        putIfPresent(fields, "energy_delivered_kwh", report.getEnergyDeliveredKwh());
        putIfPresent(fields, "duration_minutes", report.getDurationMinutes());
        fields.put("last_updated", Instant.now().toString());
        Map<String, Object> finished = store.update(path, fields);

        Object userId = finished.get("user_id");
        if (userId != null) {
            store.delete(activeIndexPath(userId.toString()) + "/" + sessionKey(providerId, sessionId));
        }
        store.set(historyPath(providerId, sessionId), finished);
        return Optional.of(fromDocument(finished));
    }

    /** The live record only; archived sessions are not returned. */
    public Optional<ChargingSession> findLiveSession(String providerId, String sessionId) {
        return store.get(sessionPath(providerId, sessionId)).map(LiveStateService::fromDocument);
    }

    /** The live record, or the archived copy when the live one is gone. */
    public Optional<ChargingSession> getSession(String providerId, String sessionId) {
        Optional<ChargingSession> live = findLiveSession(providerId, sessionId);
        if (live.isPresent()) {
            return live;
        }
        return store.get(historyPath(providerId, sessionId)).map(LiveStateService::fromDocument);
    }

    /**
     * Every stored record carrying this provider-issued id, whichever provider issued it.
     * A live record hides its own archived copy.
     */
    public List<ChargingSession> findSessions(String sessionId) {
        Map<String, ChargingSession> found = new LinkedHashMap<>();
        for (String root : List.of("sessions", "sessions_history")) {
            store.children(root).forEach((key, doc) -> {
                if (sessionId.equals(doc.get("session_id"))) {
                    found.putIfAbsent(key, fromDocument(doc));
                }
            });
        }
        return new ArrayList<>(found.values());
    }

    public List<ChargingSession> getActiveSessions(String userId) {
        List<ChargingSession> sessions = new ArrayList<>();
        store.children(activeIndexPath(userId)).values().forEach(entry -> {
            Object provider = entry.get("provider");
            Object sessionId = entry.get("session_id");
            if (provider != null && sessionId != null) {
                findLiveSession(provider.toString(), sessionId.toString()).ifPresent(sessions::add);
            }
        });
        return sessions;
    }

    /** Archived sessions of one user, most recently ended first. */
    public List<ChargingSession> getSessionHistory(String userId) {
        List<ChargingSession> sessions = new ArrayList<>();
        store.children("sessions_history").values().forEach(doc -> {
            if (userId.equals(doc.get("user_id"))) {
                sessions.add(fromDocument(doc));
            }
        });
        sessions.sort(Comparator.comparing(ChargingSession::getEndedAt,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return sessions;
    }

    /* ---------- users & analytics ---------- */

    public String sendNotification(String userId, Notification notification) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("type", notification.getType());
        doc.put("title", notification.getTitle());
        doc.put("message", notification.getMessage());
        doc.put("session_id", notification.getSessionId());
        doc.put("timestamp", Instant.now().toString());
        doc.put("read", false);
        return store.push(notificationsPath(userId), doc);
    }

    public List<Notification> getNotifications(String userId) {
        List<Notification> notifications = new ArrayList<>();
        store.children(notificationsPath(userId)).values().forEach(doc -> notifications.add(Notification.builder()
                .type(asString(doc.get("type")))
                .title(asString(doc.get("title")))
                .message(asString(doc.get("message")))
                .sessionId(asString(doc.get("session_id")))
                .timestamp(asInstant(doc.get("timestamp")))
                .read(Boolean.TRUE.equals(doc.get("read")))
                .build()));
        return notifications;
    }

    public void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> doc = new LinkedHashMap<>(data);
        doc.put("timestamp", Instant.now().toString());
        store.push("analytics/" + eventType, doc);
    }

    /* ---------- paths & mapping ---------- */

    static String stationStatusPath(String stationId) {
        return "stations/" + stationId + "/status";
    }

    static String chargersPath(String stationId) {
        return "stations/" + stationId + "/chargers";
    }

    /** Session ids are only unique per provider. */
    static String sessionKey(String providerId, String sessionId) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Session " + sessionId + " has no provider");
        }
        return providerId + ":" + sessionId;
    }

    static String sessionPath(String providerId, String sessionId) {
        return "sessions/" + sessionKey(providerId, sessionId);
    }

    static String historyPath(String providerId, String sessionId) {
        return "sessions_history/" + sessionKey(providerId, sessionId);
    }

    static String activeIndexPath(String userId) {
        return "users/" + userId + "/active_sessions";
    }

    static String notificationsPath(String userId) {
        return "users/" + userId + "/notifications";
    }

    private static Map<String, Object> toDocument(ChargingSession session) {
        Map<String, Object> doc = new LinkedHashMap<>();
        putIfPresent(doc, "session_id", session.getSessionId());
        putIfPresent(doc, "user_id", session.getUserId());
        putIfPresent(doc, "station_id", session.getStationId());
        putIfPresent(doc, "charger_id", session.getChargerId());
        putIfPresent(doc, "provider", session.getProvider());
        putIfPresent(doc, "connector_type", session.getConnectorType() == null ? null : session.getConnectorType().getLabel());
        putIfPresent(doc, "status", session.getStatus() == null ? null : session.getStatus().getValue());
        putIfPresent(doc, "started_at", session.getStartedAt() == null ? null : session.getStartedAt().toString());
        putIfPresent(doc, "ended_at", session.getEndedAt() == null ? null : session.getEndedAt().toString());
        putIfPresent(doc, "energy_delivered_kwh", session.getEnergyDeliveredKwh());
        putIfPresent(doc, "duration_minutes", session.getDurationMinutes());
        putIfPresent(doc, "estimated_kwh", session.getEstimatedKwh());
        return doc;
    }

    private static ChargingSession fromDocument(Map<String, Object> doc) {
        Object status = doc.get("status");
        Object connector = doc.get("connector_type");
        return ChargingSession.builder()
                .sessionId(asString(doc.get("session_id")))
                .userId(asString(doc.get("user_id")))
                .stationId(asString(doc.get("station_id")))
                .chargerId(asString(doc.get("charger_id")))
                .provider(asString(doc.get("provider")))
                .connectorType(connector == null ? null : ConnectorType.lookup(connector.toString()).orElse(null))
                .status(status == null ? null : SessionStatus.fromValue(status.toString()))
                .startedAt(asInstant(doc.get("started_at")))
                .endedAt(asInstant(doc.get("ended_at")))
                .energyDeliveredKwh(asDouble(doc.get("energy_delivered_kwh")))
                .durationMinutes(asInteger(doc.get("duration_minutes")))
                .estimatedKwh(asDouble(doc.get("estimated_kwh")))
                .build();
    }

    private static StationAvailability toAvailability(Map<String, Object> doc) {
        Integer available = asInteger(doc.get("available_chargers"));
        Integer total = asInteger(doc.get("total_chargers"));
        Object operational = doc.get("operational");
        return StationAvailability.builder()
                .availableChargers(available == null ? 0 : available)
                .totalChargers(total == null ? 0 : total)
                .operational(operational == null || Boolean.TRUE.equals(operational))
                .lastUpdated(asInstant(doc.get("last_updated")))
                .build();
    }

    private static void putIfPresent(Map<String, Object> doc, String key, Object value) {
        if (value != null) {
            doc.put(key, value);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static Integer asInteger(Object value) {
        return value instanceof Number n ? n.intValue() : null;
    }

    private static Instant asInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        return value == null ? null : Instant.parse(value.toString());
    }
}
