package com.prospectenhancer.cleanup;

/**
 * Prospect counts per enhancement status. {@code longRunning} is the subset of {@code inProgress}
 * started before the stale threshold.
 */
public record EnhancementStatistics(long idle, long inProgress, long failed, long longRunning, long total) {
}
