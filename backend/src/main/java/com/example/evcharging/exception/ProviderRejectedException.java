package com.example.evcharging.exception;

import lombok.Getter;

/**
 * The upstream answered and refused the request (charger busy, unauthorized, unknown id).
 * Try another charger.
 */
@Getter
public class ProviderRejectedException extends ProviderException {

    private final int upstreamStatus;

    public ProviderRejectedException(String providerId, int upstreamStatus, String message, Throwable cause) {
        super(providerId, message, cause);
        this.upstreamStatus = upstreamStatus;
    }

    public ProviderRejectedException(String providerId, String message) {
        this(providerId, 0, message, null);
    }

    @Override
    public FailureReason getReason() {
        return FailureReason.REJECTED;
    }
}
