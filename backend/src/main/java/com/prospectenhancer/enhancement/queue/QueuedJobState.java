package com.prospectenhancer.enhancement.queue;

public enum QueuedJobState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public String value() {
        return name().toLowerCase();
    }
}
