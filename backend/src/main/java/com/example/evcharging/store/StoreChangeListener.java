package com.example.evcharging.store;

import java.util.Map;

@FunctionalInterface
public interface StoreChangeListener {

    /**
     * @param document the document after the change, or null when it was deleted
     */
    void onChange(String path, Map<String, Object> document);
}
