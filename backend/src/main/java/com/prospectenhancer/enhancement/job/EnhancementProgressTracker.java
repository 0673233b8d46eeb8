package com.prospectenhancer.enhancement.job;

import com.prospectenhancer.domain.EnhancementKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable progress of the current iterative run, guarded by one lock. Each run gets a generation number;
 * updates carrying an older generation are ignored so a late worker cannot overwrite a newer run.
 */
@Component
public class EnhancementProgressTracker {

    static final int TITLE_LIMIT = 100;

    private final Object lock = new Object();

    private long generation;
    private EnhancementRunStatus status = EnhancementRunStatus.IDLE;
    private String currentType;
    private int processed;
    private int total;
    private EnhancementProgress.CurrentRecord currentRecord;
    private Instant startedAt;
    private final List<EnhancementProgress.ProgressError> errors = new ArrayList<>();
    private String jobId;
    private String errorMessage;

    /**
     * Resets all counters for a new run.
     *
     * @return the new run's generation
     */
    public long begin(EnhancementKind kind, int total, EnhancementRunStatus initialStatus, String jobId) {
        synchronized (lock) {
            generation++;
            this.status = initialStatus;
            this.currentType = kind.value();
            this.processed = 0;
            this.total = total;
            this.currentRecord = null;
            this.startedAt = Instant.now();
            this.errors.clear();
            this.jobId = jobId;
            this.errorMessage = null;
            return generation;
        }
    }

    public boolean isActive() {
        synchronized (lock) {
            return status.isActive();
        }
    }

    public void setCurrent(long gen, String recordId, String title) {
        synchronized (lock) {
            if (gen != generation) {
                return;
            }
            String shown = title == null ? "Untitled" : title.substring(0, Math.min(TITLE_LIMIT, title.length()));
            currentRecord = new EnhancementProgress.CurrentRecord(recordId, shown);
        }
    }

    public void recordSuccess(long gen) {
        synchronized (lock) {
            if (gen == generation) {
                processed++;
            }
        }
    }

    public void recordError(long gen, String recordId, String error) {
        synchronized (lock) {
            if (gen == generation) {
                errors.add(new EnhancementProgress.ProgressError(recordId, error, Instant.now()));
            }
        }
    }

    /** Copies counters reported by an external job. */
    public void mirror(long gen, EnhancementRunStatus newStatus, int newProcessed, int newTotal) {
        synchronized (lock) {
            if (gen != generation || !status.isActive()) {
                return;
            }
            status = newStatus;
            processed = newProcessed;
            total = newTotal;
        }
    }

    /**
     * Moves an active run of this generation to a terminal status. No-op if the run already ended.
     */
    public void finish(long gen, EnhancementRunStatus terminal, String error) {
        synchronized (lock) {
            if (gen != generation || !status.isActive()) {
                return;
            }
            status = terminal;
            currentRecord = null;
            if (error != null) {
                errorMessage = error;
            }
        }
    }

    /** Force-reports STOPPED for the current run, whatever the worker is doing. */
    public EnhancementProgress forceStopped() {
        synchronized (lock) {
            if (status.isActive()) {
                status = EnhancementRunStatus.STOPPED;
                currentRecord = null;
            }
            return snapshotLocked();
        }
    }

    public EnhancementProgress snapshot() {
        synchronized (lock) {
            return snapshotLocked();
        }
    }

    /** Snapshot of the given run, or null once a newer run has started. */
    public EnhancementProgress snapshot(long gen) {
        synchronized (lock) {
            return gen == generation ? snapshotLocked() : null;
        }
    }

    private EnhancementProgress snapshotLocked() {
        return new EnhancementProgress(status, currentType, processed, total, currentRecord, startedAt,
                List.copyOf(errors), jobId, errorMessage);
    }
}
