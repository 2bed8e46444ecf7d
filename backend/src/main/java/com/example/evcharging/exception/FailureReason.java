package com.example.evcharging.exception;

public enum FailureReason {
    /** Upstream refused: busy charger, bad credentials, unknown id. */
    REJECTED,
    /** Upstream unreachable, timed out or answered 5xx. */
    UNAVAILABLE,
    /** The session is not in a state that allows the operation. */
    NOT_ACTIVE
}
