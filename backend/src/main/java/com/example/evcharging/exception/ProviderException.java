package com.example.evcharging.exception;

import lombok.Getter;

/**
 * Failure reported by (or while talking to) an upstream charging network.
 */
@Getter
public abstract class ProviderException extends RuntimeException {

    private final String providerId;

    protected ProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    public abstract FailureReason getReason();
}
