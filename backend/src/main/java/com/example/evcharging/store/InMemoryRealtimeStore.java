package com.example.evcharging.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link RealtimeStore}. Each document is updated atomically through
 * {@code compute}, so concurrent partial updates on different documents (or different
 * fields of one document) never clobber each other. Listeners are notified after the
 * change is applied, outside the atomic section.
 */
@Slf4j
public class InMemoryRealtimeStore implements RealtimeStore {

    private final ConcurrentSkipListMap<String, Map<String, Object>> documents = new ConcurrentSkipListMap<>();
    private final List<StoreChangeListener> listeners;
    private final AtomicLong pushSequence = new AtomicLong();

    public InMemoryRealtimeStore(List<StoreChangeListener> listeners) {
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public InMemoryRealtimeStore() {
        this(List.of());
    }

    @Override
    public Optional<Map<String, Object>> get(String path) {
        Map<String, Object> doc = documents.get(normalize(path));
        return Optional.ofNullable(doc).map(InMemoryRealtimeStore::copy);
    }

    @Override
    public void set(String path, Map<String, Object> document) {
        String key = normalize(path);
        Map<String, Object> stored = withoutNulls(document);
        documents.put(key, stored);
        fireChange(key, stored);
    }

    @Override
    public boolean setIfAbsent(String path, Map<String, Object> document) {
        String key = normalize(path);
        Map<String, Object> stored = withoutNulls(document);
        boolean created = documents.putIfAbsent(key, stored) == null;
        if (created) {
            fireChange(key, stored);
        }
        return created;
    }

    @Override
    public Map<String, Object> update(String path, Map<String, Object> fields) {
        String key = normalize(path);
        AtomicReference<Map<String, Object>> result = new AtomicReference<>();
        documents.compute(key, (k, current) -> {
            Map<String, Object> next = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
            fields.forEach((field, value) -> {
                if (value == null) {
                    next.remove(field);
                } else {
                    next.put(field, value);
                }
            });
            Map<String, Object> frozen = Collections.unmodifiableMap(next);
            result.set(frozen);
            return frozen;
        });
        fireChange(key, result.get());
        return copy(result.get());
    }

    @Override
    public boolean delete(String path) {
        String key = normalize(path);
        boolean removed = documents.remove(key) != null;
        if (removed) {
            fireChange(key, null);
        }
        return removed;
    }

    @Override
    public boolean exists(String path) {
        return documents.containsKey(normalize(path));
    }

    @Override
    public String push(String listPath, Map<String, Object> document) {
        String childKey = String.format("%013d-%06d", System.currentTimeMillis(), pushSequence.incrementAndGet());
        set(normalize(listPath) + "/" + childKey, document);
        return childKey;
    }

    @Override
    public Map<String, Map<String, Object>> children(String path) {
        String prefix = normalize(path) + "/";
        // '0' is the character right after '/', so this view holds exactly the keys under prefix
        NavigableMap<String, Map<String, Object>> range =
                documents.subMap(prefix, true, prefix.substring(0, prefix.length() - 1) + "0", false);
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        range.forEach((key, doc) -> {
            String child = key.substring(prefix.length());
            if (!child.contains("/")) {
                result.put(child, copy(doc));
            }
        });
        return result;
    }

    /** Point-in-time copy of every document, used for snapshots. */
    public Map<String, Map<String, Object>> exportSnapshot() {
        Map<String, Map<String, Object>> snapshot = new LinkedHashMap<>();
        documents.forEach((key, doc) -> snapshot.put(key, copy(doc)));
        return snapshot;
    }

    public void importSnapshot(Map<String, Map<String, Object>> snapshot) {
        snapshot.forEach((key, doc) -> documents.put(normalize(key), withoutNulls(doc)));
        log.info("Imported {} documents into realtime store", snapshot.size());
    }

    public int size() {
        return documents.size();
    }

    private void fireChange(String path, Map<String, Object> document) {
        Map<String, Object> view = document == null ? null : copy(document);
        for (StoreChangeListener listener : listeners) {
            try {
                listener.onChange(path, view);
            } catch (RuntimeException e) {
                log.warn("Store listener failed for {}: {}", path, e.getMessage());
            }
        }
    }

    private static String normalize(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Store path must not be blank");
        }
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> document) {
        Map<String, Object> copy = new LinkedHashMap<>();
        document.forEach((k, v) -> {
            if (v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, Object> copy(Map<String, Object> document) {
        return new LinkedHashMap<>(document);
    }
}
