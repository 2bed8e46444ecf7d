package com.example.evcharging.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one adapter call during fan-out: either a value or a failure reason,
 * so one provider's failure never invalidates the others' results.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderResult<T> {
    private final String providerId;
    private final T value;
    private final String failureReason;
    private final long elapsedMs;

    public static <T> ProviderResult<T> success(String providerId, T value, long elapsedMs) {
        return new ProviderResult<>(providerId, value, null, elapsedMs);
    }

    public static <T> ProviderResult<T> failure(String providerId, String reason, long elapsedMs) {
        return new ProviderResult<>(providerId, null, reason, elapsedMs);
    }

    public boolean isSuccess() {
        return failureReason == null;
    }
}
