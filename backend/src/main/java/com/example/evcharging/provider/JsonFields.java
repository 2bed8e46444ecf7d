package com.example.evcharging.provider;

import com.example.evcharging.model.ConnectorType;
import com.example.evcharging.model.SessionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Null-tolerant readers for upstream JSON payloads.
 */
@Slf4j
public final class JsonFields {

    private static final Set<String> ACTIVE_WORDS = Set.of("active", "charging", "in_progress", "inprogress", "started", "running");
    private static final Set<String> COMPLETED_WORDS = Set.of("completed", "complete", "stopped", "finished", "ended", "done");
    private static final Set<String> FAILED_WORDS = Set.of("failed", "error", "rejected", "faulted", "aborted", "cancelled");

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            raw -> OffsetDateTime.parse(raw).toInstant(),
            raw -> LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC));

    private JsonFields() {
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }

    public static Double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        try {
            return Double.valueOf(value.asText());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value for {}: {}", field, value);
            return null;
        }
    }

    public static Integer integer(JsonNode node, String field) {
        Double value = decimal(node, field);
        return value == null ? null : (int) Math.round(value);
    }

    public static boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.asBoolean(false);
    }

    public static List<String> strings(JsonNode node, String field) {
        List<String> result = new ArrayList<>();
        JsonNode array = node.get(field);
        if (array != null && array.isArray()) {
            array.forEach(item -> result.add(item.asText()));
        }
        return result;
    }

    public static ConnectorType connector(JsonNode node, String field) {
        return ConnectorType.lookup(text(node, field)).orElse(null);
    }

    /**
     * Accepts ISO instants ("2024-01-15T10:00:00Z"), offset date-times and zone-less
     * local date-times, which are read as UTC.
     */
    public static Instant instant(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        DateTimeParseException last = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(raw);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.debug("Unparseable timestamp for {}: {} ({})", field, raw, last.getMessage());
        return null;
    }

    public static SessionStatus sessionStatus(String raw, SessionStatus fallback) {
        if (raw == null) {
            return fallback;
        }
        String word = raw.trim().toLowerCase(Locale.ROOT);
        if (ACTIVE_WORDS.contains(word)) {
            return SessionStatus.ACTIVE;
        }
        if (COMPLETED_WORDS.contains(word)) {
            return SessionStatus.COMPLETED;
        }
        if (FAILED_WORDS.contains(word)) {
            return SessionStatus.FAILED;
        }
        return fallback;
    }
}
