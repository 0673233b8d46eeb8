package com.prospectenhancer.enhancement.queue;

import com.prospectenhancer.domain.EnhancementKind;

import java.util.List;
import java.util.Optional;

/**
 * Accepts enhancement work for asynchronous processing and reports on it by job id.
 * Optional: when no implementation is registered, iterative runs process directly.
 */
public interface EnhancementJobQueue {

    /**
     * Queues a bulk job over the given prospects.
     *
     * @param force re-process fields that already carry an enhancement
     * @return the job id
     */
    String submitBulk(List<String> prospectIds, EnhancementKind kind, boolean force, String ownerId);

    /** Queues a single prospect ahead of bulk work; returns the job id. */
    String submitIndividual(String prospectId, EnhancementKind kind, String ownerId);

    Optional<QueuedJobStatus> status(String jobId);

    /** @return true if the job existed and was not yet terminal */
    boolean cancel(String jobId);
}
