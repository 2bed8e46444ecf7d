package com.example.evcharging.config;

import com.example.evcharging.store.InMemoryRealtimeStore;
import com.example.evcharging.store.StoreChangeListener;
import com.example.evcharging.store.StoreSnapshotRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

@Slf4j
@Configuration
public class RealtimeStoreConfig {

    @Bean
    public InMemoryRealtimeStore realtimeStore(List<StoreChangeListener> listeners) {
        log.info("In-memory realtime store with {} change listeners", listeners.size());
        return new InMemoryRealtimeStore(listeners);
    }

    /**
     * Restores the store from its snapshot at startup and writes it back at shutdown,
     * only when {@code ev.store.snapshot-file} is set.
     */
    @Bean
    public StoreSnapshotLifecycle storeSnapshotLifecycle(StoreProperties properties, ObjectMapper objectMapper,
                                                         InMemoryRealtimeStore store) {
        String file = properties.getSnapshotFile();
        if (file == null || file.isBlank()) {
            return new StoreSnapshotLifecycle(Optional.empty());
        }
        StoreSnapshotRepository repository = new StoreSnapshotRepository(objectMapper, Path.of(file), store);
        repository.load();
        return new StoreSnapshotLifecycle(Optional.of(repository));
    }

    public static class StoreSnapshotLifecycle implements DisposableBean {

        private final Optional<StoreSnapshotRepository> repository;

        StoreSnapshotLifecycle(Optional<StoreSnapshotRepository> repository) {
            this.repository = repository;
        }

        @Override
        public void destroy() {
            repository.ifPresent(StoreSnapshotRepository::save);
        }
    }
}
