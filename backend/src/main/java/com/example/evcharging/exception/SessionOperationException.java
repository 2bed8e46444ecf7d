package com.example.evcharging.exception;

import lombok.Getter;

/**
 * Single caller-visible outcome of a failed start or stop. The reason is carried for
 * diagnostics and status mapping only.
 */
@Getter
public abstract class SessionOperationException extends RuntimeException {

    private final String providerId;
    private final FailureReason reason;

    protected SessionOperationException(String providerId, FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.reason = reason;
    }
}
