package com.prospectenhancer.enhancement.job;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the iterative run's progress.
 */
public record EnhancementProgress(
        EnhancementRunStatus status,
        String currentType,
        int processed,
        int total,
        CurrentRecord currentRecord,
        Instant startedAt,
        List<ProgressError> errors,
        String jobId,
        String errorMessage
) {

    public record CurrentRecord(String id, String title) {
    }

    /** {@code error} is null when the record simply yielded no enhancement. */
    public record ProgressError(String recordId, String error, Instant timestamp) {
    }
}
