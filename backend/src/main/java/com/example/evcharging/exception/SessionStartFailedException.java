package com.example.evcharging.exception;

public class SessionStartFailedException extends SessionOperationException {

    public SessionStartFailedException(String providerId, FailureReason reason, String message, Throwable cause) {
        super(providerId, reason, message, cause);
    }
}
