package com.example.evcharging.exception;

/**
 * Timeout, transport failure or upstream 5xx. Try again later.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String providerId, String message, Throwable cause) {
        super(providerId, message, cause);
    }

    public ProviderUnavailableException(String providerId, String message) {
        this(providerId, message, null);
    }

    @Override
    public FailureReason getReason() {
        return FailureReason.UNAVAILABLE;
    }
}
