package com.example.evcharging.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ConnectorType {
    CCS("CCS"),
    CHADEMO("CHAdeMO"),
    TYPE2("Type2"),
    TESLA("Tesla");

    private final String label;

    ConnectorType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Lenient lookup used when normalizing upstream payloads: matches the label or the
     * constant name, ignoring case, spaces, dashes and underscores ("Type 2", "TYPE_2", "type2").
     */
    public static Optional<ConnectorType> lookup(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String key = normalize(value);
        return Arrays.stream(values())
                .filter(t -> normalize(t.label).equals(key) || normalize(t.name()).equals(key))
                .findFirst();
    }

    @JsonCreator
    public static ConnectorType fromLabel(String value) {
        return lookup(value).orElseThrow(() ->
                new IllegalArgumentException("Unknown connector type: " + value));
    }

    private static String normalize(String value) {
        return value.replaceAll("[\\s_\\-]", "").toLowerCase();
    }
}
