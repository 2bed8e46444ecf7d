package com.example.evcharging.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Saves and restores the in-memory store as one JSON file, so live state survives a restart
 * in single-node deployments.
 */
@Slf4j
public class StoreSnapshotRepository {

    private static final TypeReference<Map<String, Map<String, Object>>> SNAPSHOT_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path snapshotFile;
    private final InMemoryRealtimeStore store;

    public StoreSnapshotRepository(ObjectMapper objectMapper, Path snapshotFile, InMemoryRealtimeStore store) {
        this.objectMapper = objectMapper;
        this.snapshotFile = snapshotFile;
        this.store = store;
    }

    public void load() {
        if (!Files.exists(snapshotFile)) {
            log.info("No store snapshot at {}, starting empty", snapshotFile);
            return;
        }
        try {
            Map<String, Map<String, Object>> snapshot = objectMapper.readValue(snapshotFile.toFile(), SNAPSHOT_TYPE);
            store.importSnapshot(snapshot);
        } catch (IOException e) {
            throw new StoreException("Failed to load store snapshot from " + snapshotFile, e);
        }
    }

    public void save() {
        try {
            Path parent = snapshotFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(store.exportSnapshot());
            Files.writeString(snapshotFile, json);
            log.info("Saved {} store documents to {}", store.size(), snapshotFile);
        } catch (IOException e) {
            throw new StoreException("Failed to save store snapshot to " + snapshotFile, e);
        }
    }
}
