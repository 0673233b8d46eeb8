package com.prospectenhancer.enhancement.queue;

/**
 * Point-in-time view of a queued job.
 */
public record QueuedJobStatus(String jobId, QueuedJobState state, int processed, int total, String error) {
}
