package com.prospectenhancer.domain;

/**
 * Record-level enhancement state. IN_PROGRESS always carries a start timestamp.
 */
public enum EnhancementStatus {
    IDLE,
    IN_PROGRESS,
    FAILED
}
