package com.example.evcharging.store;

import java.util.Map;
import java.util.Optional;

/**
 * Key-structured document store holding live station, session and user state.
 * <p>
 * Paths are slash separated ({@code stations/st1/status}). Every document is a flat map.
 * Readers must tolerate eventual consistency: a write by one actor may not yet be visible
 * to another. Implementations throw {@link StoreException} when a read or write fails.
 */
public interface RealtimeStore {

    Optional<Map<String, Object>> get(String path);

    /** Replaces the whole document. */
    void set(String path, Map<String, Object> document);

    /**
     * Atomically creates the document if nothing exists at {@code path}.
     *
     * @return true if the document was created
     */
    boolean setIfAbsent(String path, Map<String, Object> document);

    /**
     * Merges {@code fields} into the document, creating it when missing. A null value
     * removes that field. Fields not named are left untouched.
     *
     * @return the document after the update
     */
    Map<String, Object> update(String path, Map<String, Object> fields);

    boolean delete(String path);

    boolean exists(String path);

    /**
     * Appends a document under {@code listPath} with a generated, time-ordered key.
     *
     * @return the generated key
     */
    String push(String listPath, Map<String, Object> document);

    /** Direct children of {@code path}, keyed by their last path segment, in key order. */
    Map<String, Map<String, Object>> children(String path);
}
