package com.prospectenhancer.enhancement.job;

/**
 * Answer to a start request. {@code jobId} is set only when the run was handed to the job queue.
 */
public record StartResult(EnhancementRunStatus status, String message, int totalToProcess, String jobId) {
}
