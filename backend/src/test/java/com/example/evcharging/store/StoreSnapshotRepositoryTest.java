package com.example.evcharging.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreSnapshotRepositoryTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void savedSnapshotIsRestoredIntoAnEmptyStore() {
        Path file = tempDir.resolve("state/store.json");
        InMemoryRealtimeStore source = new InMemoryRealtimeStore();
        source.set("sessions/s1", Map.of("status", "active", "energy_delivered_kwh", 12.5));
        new StoreSnapshotRepository(objectMapper, file, source).save();

        InMemoryRealtimeStore target = new InMemoryRealtimeStore();
        new StoreSnapshotRepository(objectMapper, file, target).load();

        assertThat(target.get("sessions/s1").orElseThrow())
                .containsEntry("status", "active")
                .containsEntry("energy_delivered_kwh", 12.5);
    }

    @Test
    void missingSnapshotLeavesStoreEmpty() {
        InMemoryRealtimeStore store = new InMemoryRealtimeStore();

        new StoreSnapshotRepository(objectMapper, tempDir.resolve("absent.json"), store).load();

        assertThat(store.size()).isZero();
    }

    @Test
    void corruptSnapshotFailsLoudly() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new StoreSnapshotRepository(objectMapper, file, new InMemoryRealtimeStore()).load())
                .isInstanceOf(StoreException.class);
    }
}
