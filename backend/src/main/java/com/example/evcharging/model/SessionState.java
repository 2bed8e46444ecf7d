package com.example.evcharging.model;

/**
 * Orchestrator-side lifecycle of a charging session. Only ACTIVE, COMPLETED and FAILED
 * are ever persisted (as {@link SessionStatus}); STARTING and STOPPING live in memory
 * for the duration of the provider call.
 */
public enum SessionState {
    STARTING,
    ACTIVE,
    STOPPING,
    COMPLETED,
    FAILED
}
