package com.prospectenhancer.enhancement.job;

/**
 * Lifecycle of an iterative run: IDLE, then QUEUED or PROCESSING, then COMPLETED, STOPPED or ERROR.
 */
public enum EnhancementRunStatus {
    IDLE,
    QUEUED,
    PROCESSING,
    COMPLETED,
    STOPPED,
    ERROR;

    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public String value() {
        return name().toLowerCase();
    }
}
