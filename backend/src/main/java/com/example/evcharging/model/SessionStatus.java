package com.example.evcharging.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionStatus {
    ACTIVE,
    COMPLETED,
    FAILED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }

    @JsonCreator
    public static SessionStatus fromValue(String value) {
        return SessionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
