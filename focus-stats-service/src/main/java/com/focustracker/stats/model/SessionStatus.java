package com.focustracker.stats.model;

/**
 * Lifecycle states of a focus session
 */
public enum SessionStatus {
    SCHEDULED,
    ACTIVE,
    COMPLETED,
    CANCELLED,
    FAILED
}
