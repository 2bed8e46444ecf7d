package com.example.evcharging.service;

import com.example.evcharging.model.ChargingSession;
import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.Notification;
import com.example.evcharging.model.SessionStatus;
import com.example.evcharging.model.StationAvailability;
import com.example.evcharging.store.InMemoryRealtimeStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LiveStateServiceTest {

    private static final String PROVIDER = "chargepoint";

    private final InMemoryRealtimeStore store = new InMemoryRealtimeStore();
    private final LiveStateService liveState = new LiveStateService(store);

    @Test
    void chargerUpdatesRecountStationSummary() {
        liveState.updateChargerAvailability("st1", "c1", true, 150.0);
        StationAvailability summary = liveState.updateChargerAvailability("st1", "c2", false, null);

        assertThat(summary.getAvailableChargers()).isEqualTo(1);
        assertThat(summary.getTotalChargers()).isEqualTo(2);
        assertThat(summary.isOperational()).isTrue();
        assertThat(liveState.getChargerAvailability("st1")).containsEntry("c1", true).containsEntry("c2", false);

        StationAvailability none = liveState.updateChargerAvailability("st1", "c1", false, null);
        assertThat(none.isOperational()).isFalse();
    }

    @Test
    void createdSessionIsIndexedAsActive() {
        liveState.createSession(session("s1", "u1"));

        assertThat(liveState.getActiveSessions("u1")).extracting(ChargingSession::getSessionId).containsExactly("s1");
        assertThat(liveState.findLiveSession(PROVIDER, "s1").orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }

    @Test
    void endSessionArchivesAndClearsIndex() {
        liveState.createSession(session("s1", "u1"));
        Instant ended = Instant.parse("2024-05-01T11:00:00Z");
        ChargingSession report = ChargingSession.builder()
                .endedAt(ended).energyDeliveredKwh(25.5).durationMinutes(45).build();

        ChargingSession finished = liveState.endSession(PROVIDER, "s1", report, SessionStatus.COMPLETED).orElseThrow();

        assertThat(finished.getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(finished.getEnergyDeliveredKwh()).isEqualTo(25.5);
        assertThat(finished.getDurationMinutes()).isEqualTo(45);
        assertThat(finished.getEndedAt()).isEqualTo(ended);
        assertThat(liveState.getActiveSessions("u1")).isEmpty();
        assertThat(store.exists("sessions_history/chargepoint:s1")).isTrue();
        assertThat(liveState.getSessionHistory("u1")).extracting(ChargingSession::getSessionId).containsExactly("s1");
    }

    @Test
    void endSessionWithoutRecordChangesNothing() {
        assertThat(liveState.endSession(PROVIDER, "ghost", ChargingSession.builder().build(), SessionStatus.COMPLETED)).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void historyIsNewestFirstAndPerUser() {
        archive("old", "u1", "2024-05-01T10:00:00Z");
        archive("new", "u1", "2024-05-02T10:00:00Z");
        archive("other", "u2", "2024-05-03T10:00:00Z");

        assertThat(liveState.getSessionHistory("u1")).extracting(ChargingSession::getSessionId)
                .containsExactly("new", "old");
    }

    @Test
    void historyPutsUnfinishedRecordsLast() {
        archive("old", "u1", "2024-05-01T10:00:00Z");
        archive("new", "u1", "2024-05-02T10:00:00Z");
        Map<String, Object> undated = new LinkedHashMap<>(store.get("sessions_history/chargepoint:old").orElseThrow());
        undated.put("session_id", "undated");
        undated.remove("ended_at");
        store.set("sessions_history/chargepoint:undated", undated);

        assertThat(liveState.getSessionHistory("u1")).extracting(ChargingSession::getSessionId)
                .containsExactly("new", "old", "undated");
    }

    @Test
    void sameIdFromTwoProvidersIsTwoSessions() {
        liveState.createSession(session("1001", "u1"));
        liveState.createSession(session("1001", "u2").toBuilder().provider("evgo").stationId("st9").build());

        assertThat(liveState.findLiveSession(PROVIDER, "1001").orElseThrow())
                .extracting(ChargingSession::getUserId, ChargingSession::getStationId)
                .containsExactly("u1", "st1");
        assertThat(liveState.findLiveSession("evgo", "1001").orElseThrow().getUserId()).isEqualTo("u2");
        assertThat(liveState.getActiveSessions("u1")).extracting(ChargingSession::getProvider).containsExactly(PROVIDER);
        assertThat(liveState.findSessions("1001")).hasSize(2);
    }

    @Test
    void recordOfAnotherUserIsNotOverwritten() {
        liveState.createSession(session("s1", "u1"));

        boolean written = liveState.createSession(session("s1", "u2"));

        assertThat(written).isFalse();
        assertThat(liveState.findLiveSession(PROVIDER, "s1").orElseThrow().getUserId()).isEqualTo("u1");
        assertThat(liveState.getActiveSessions("u2")).isEmpty();
    }

    @Test
    void connectorSurvivesTheStore() {
        liveState.createSession(session("s1", "u1").toBuilder().connectorType(ConnectorType.CHADEMO).build());

        assertThat(liveState.findLiveSession(PROVIDER, "s1").orElseThrow().getConnectorType()).isEqualTo(ConnectorType.CHADEMO);
    }

    @Test
    void notificationsAreAppendedInOrder() {
        liveState.sendNotification("u1", Notification.builder().type("session_started").title("a").build());
        liveState.sendNotification("u1", Notification.builder().type("session_completed").title("b").build());

        List<Notification> notifications = liveState.getNotifications("u1");
        assertThat(notifications).extracting(Notification::getType)
                .containsExactly("session_started", "session_completed");
        assertThat(notifications).noneMatch(Notification::isRead);
    }

    @Test
    void eventsArePushedUnderTheirType() {
        liveState.logEvent("station_issue", Map.of("station_id", "st1"));

        assertThat(store.children("analytics/station_issue")).hasSize(1);
    }

    private void archive(String id, String userId, String endedAt) {
        liveState.createSession(session(id, userId));
        liveState.endSession(PROVIDER, id, ChargingSession.builder().endedAt(Instant.parse(endedAt)).build(), SessionStatus.COMPLETED);
    }

    private static ChargingSession session(String id, String userId) {
        return ChargingSession.builder()
                .sessionId(id)
                .userId(userId)
                .stationId("st1")
                .chargerId("c1")
                .provider(PROVIDER)
                .status(SessionStatus.ACTIVE)
                .startedAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build();
    }
}
