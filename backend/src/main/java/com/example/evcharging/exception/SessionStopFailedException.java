package com.example.evcharging.exception;

public class SessionStopFailedException extends SessionOperationException {

    public SessionStopFailedException(String providerId, FailureReason reason, String message, Throwable cause) {
        super(providerId, reason, message, cause);
    }

    public SessionStopFailedException(String providerId, FailureReason reason, String message) {
        this(providerId, reason, message, null);
    }
}
