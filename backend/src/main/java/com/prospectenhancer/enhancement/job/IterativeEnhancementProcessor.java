package com.prospectenhancer.enhancement.job;

import com.prospectenhancer.config.AsyncConfig;
import com.prospectenhancer.domain.EnhancementKind;
import com.prospectenhancer.domain.EnrichmentRunLog;
import com.prospectenhancer.domain.EnrichmentRunLogRepository;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.domain.ProspectRepository;
import com.prospectenhancer.enhancement.config.EnhancementProperties;
import com.prospectenhancer.enhancement.engine.EnhancementEngine;
import com.prospectenhancer.enhancement.engine.EnhancementOutcome;
import com.prospectenhancer.enhancement.queue.EnhancementJobQueue;
import com.prospectenhancer.enhancement.queue.QueuedJobState;
import com.prospectenhancer.enhancement.queue.QueuedJobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Enhances eligible prospects one at a time in a background worker, most recently loaded first, with
 * start/stop control and live progress. Only one run is active per process.
 * <p>
 * When an {@link EnhancementJobQueue} is registered the run is handed to it as a bulk job and a monitor
 * mirrors the job's state into progress instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IterativeEnhancementProcessor {

    static final String WORKER_OWNER_ID = "iterative-worker";

    private final ProspectRepository prospectRepository;
    private final EnrichmentRunLogRepository enrichmentRunLogRepository;
    private final EnhancementEngine enhancementEngine;
    private final EnhancementProgressTracker progressTracker;
    private final EnhancementProperties properties;
    private final ObjectProvider<EnhancementJobQueue> jobQueueProvider;
    @Qualifier(AsyncConfig.ENHANCEMENT_WORKER_EXECUTOR)
    private final Executor workerExecutor;
    @Qualifier(AsyncConfig.QUEUE_MONITOR_EXECUTOR)
    private final Executor monitorExecutor;

    /** Guarded by this. */
    private ActiveRun activeRun;

    private record ActiveRun(CancellationToken token, CompletableFuture<Void> future, String jobId) {
    }

    /**
     * @throws EnhancementJobException UNKNOWN_KIND for an unrecognized kind name, ALREADY_RUNNING if a run is active
     */
    public StartResult start(String kind, boolean skipExisting) {
        EnhancementKind parsed;
        try {
            parsed = EnhancementKind.fromValue(kind);
        } catch (IllegalArgumentException e) {
            throw new EnhancementJobException(EnhancementJobException.UNKNOWN_KIND, e.getMessage());
        }
        return start(parsed, skipExisting);
    }

    /**
     * @throws EnhancementJobException ALREADY_RUNNING if a run is active
     */
    public synchronized StartResult start(EnhancementKind kind, boolean skipExisting) {
        if (progressTracker.isActive()) {
            throw new EnhancementJobException(EnhancementJobException.ALREADY_RUNNING,
                    "An enhancement run is already in progress");
        }
        int total = (int) prospectRepository.countEligible(kind, skipExisting);
        if (total == 0) {
            long gen = progressTracker.begin(kind, 0, EnhancementRunStatus.PROCESSING, null);
            progressTracker.finish(gen, EnhancementRunStatus.COMPLETED, null);
            log.info("No prospects need {} enhancement", kind.value());
            return new StartResult(EnhancementRunStatus.COMPLETED, "No prospects need " + kind.value() + " enhancement", 0, null);
        }
        EnhancementJobQueue queue = jobQueueProvider.getIfAvailable();
        if (queue != null) {
            return startQueued(queue, kind, skipExisting);
        }
        CancellationToken token = new CancellationToken();
        long gen = progressTracker.begin(kind, total, EnhancementRunStatus.PROCESSING, null);
        WorkerRun run = new WorkerRun(gen, kind, skipExisting, total, token);
        activeRun = new ActiveRun(token, CompletableFuture.runAsync(run, workerExecutor), null);
        log.info("Started {} enhancement for {} prospects", kind.value(), total);
        return new StartResult(EnhancementRunStatus.PROCESSING, "Started " + kind.value() + " enhancement", total, null);
    }

    private StartResult startQueued(EnhancementJobQueue queue, EnhancementKind kind, boolean skipExisting) {
        List<String> ids = prospectRepository.findEligibleIds(kind, skipExisting);
        String jobId = queue.submitBulk(ids, kind, !skipExisting, WORKER_OWNER_ID);
        CancellationToken token = new CancellationToken();
        long gen = progressTracker.begin(kind, ids.size(), EnhancementRunStatus.QUEUED, jobId);
        QueueMonitor monitor = new QueueMonitor(gen, kind, queue, jobId, token);
        activeRun = new ActiveRun(token, CompletableFuture.runAsync(monitor, monitorExecutor), jobId);
        log.info("Queued {} enhancement for {} prospects as job {}", kind.value(), ids.size(), jobId);
        return new StartResult(EnhancementRunStatus.QUEUED, "Queued " + kind.value() + " enhancement", ids.size(), jobId);
    }

    /**
     * Signals the worker, waits up to the stop timeout for the in-flight record, then reports STOPPED.
     */
    public StopResult stop() {
        ActiveRun run;
        synchronized (this) {
            run = activeRun;
        }
        if (run == null || !progressTracker.isActive()) {
            EnhancementProgress current = progressTracker.snapshot();
            return new StopResult(current.status(), current.processed());
        }
        log.info("Stopping enhancement run");
        run.token().cancel();
        EnhancementJobQueue queue = run.jobId() != null ? jobQueueProvider.getIfAvailable() : null;
        if (queue != null) {
            queue.cancel(run.jobId());
        }
        Duration timeout = properties.getStopTimeout();
        try {
            run.future().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Worker still busy after {}, its in-flight result will be discarded", timeout);
            run.token().abandon();
        } catch (ExecutionException e) {
            log.error("Worker ended abnormally: {}", e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.token().abandon();
        }
        EnhancementProgress progress = progressTracker.forceStopped();
        return new StopResult(progress.status(), progress.processed());
    }

    public EnhancementProgress getProgress() {
        return progressTracker.snapshot();
    }

    private void writeRunLog(EnhancementKind kind, EnhancementRunStatus status, int processed, int total,
                             Instant startedAt, String error) {
        EnrichmentRunLog entry = new EnrichmentRunLog();
        entry.setEnhancementType(kind.value());
        entry.setStatus(status.value());
        entry.setProcessedCount(processed);
        entry.setDurationSeconds(Duration.between(startedAt, Instant.now()).toMillis() / 1000.0);
        entry.setMessage("Processed " + processed + " of " + total + " prospects");
        entry.setError(error);
        entry.setTimestamp(Instant.now());
        try {
            enrichmentRunLogRepository.save(entry);
        } catch (RuntimeException e) {
            log.error("Failed to write run log for {} enhancement: {}", kind.value(), e.getMessage(), e);
        }
    }

    /** Direct processing loop for one run. */
    private final class WorkerRun implements Runnable {

        private final long gen;
        private final EnhancementKind kind;
        private final boolean skipExisting;
        private final int total;
        private final CancellationToken token;
        private final Set<String> attempted = new HashSet<>();
        private int processed;

        WorkerRun(long gen, EnhancementKind kind, boolean skipExisting, int total, CancellationToken token) {
            this.gen = gen;
            this.kind = kind;
            this.skipExisting = skipExisting;
            this.total = total;
            this.token = token;
        }

        @Override
        public void run() {
            Instant startedAt = Instant.now();
            EnhancementRunStatus outcome = EnhancementRunStatus.COMPLETED;
            String error = null;
            try {
                while (true) {
                    if (token.isCancelled()) {
                        outcome = EnhancementRunStatus.STOPPED;
                        break;
                    }
                    Optional<Prospect> next = prospectRepository.findNextEligible(kind, skipExisting, attempted);
                    if (next.isEmpty()) {
                        break;
                    }
                    Prospect prospect = next.get();
                    attempted.add(prospect.getId());
                    progressTracker.setCurrent(gen, prospect.getId(), prospect.getTitle());
                    if (token.isCancelled()) {
                        log.info("Stop requested before prospect {}, ending run", prospect.getId());
                        outcome = EnhancementRunStatus.STOPPED;
                        break;
                    }
                    processOne(prospect);
                }
            } catch (RuntimeException e) {
                outcome = EnhancementRunStatus.ERROR;
                error = e.getMessage();
                log.error("{} enhancement run failed: {}", kind.value(), e.getMessage(), e);
            } finally {
                progressTracker.finish(gen, outcome, error);
                log.info("{} enhancement run ended {}: {} of {} prospects enhanced",
                        kind.value(), outcome.value(), processed, total);
                writeRunLog(kind, outcome, processed, total, startedAt, error);
            }
        }

        private void processOne(Prospect prospect) {
            String id = prospect.getId();
            try {
                prospect.markInProgress(WORKER_OWNER_ID, Instant.now());
                prospectRepository.save(prospect);
                EnhancementOutcome result = enhancementEngine.enhanceOne(prospect, kind, !skipExisting);
                boolean kept = token.runUnlessAbandoned(() -> {
                    prospect.markIdle();
                    prospectRepository.save(prospect);
                });
                if (!kept) {
                    log.warn("Run was stopped while prospect {} was in flight, discarding its result", id);
                    release(id, false);
                    return;
                }
                if (result.anySucceeded()) {
                    processed++;
                    progressTracker.recordSuccess(gen);
                } else {
                    progressTracker.recordError(gen, id, null);
                }
                log.debug("Processed prospect {}: {}/{} enhanced", id, processed, total);
            } catch (RuntimeException e) {
                log.error("Error processing prospect {}: {}", id, e.getMessage(), e);
                progressTracker.recordError(gen, id, e.getMessage());
                release(id, true);
            }
        }

        /** Reloads the stored prospect so unsaved in-memory changes are dropped, then clears its in-progress mark. */
        private void release(String id, boolean failed) {
            try {
                prospectRepository.findById(id).ifPresent(stored -> {
                    if (failed) {
                        stored.markFailed();
                    } else {
                        stored.markIdle();
                    }
                    prospectRepository.save(stored);
                });
            } catch (RuntimeException e) {
                log.error("Could not release prospect {} after failure: {}", id, e.getMessage(), e);
            }
        }
    }

    /** Mirrors a queued bulk job into progress until the job ends or the run is stopped. */
    private final class QueueMonitor implements Runnable {

        private final long gen;
        private final EnhancementKind kind;
        private final EnhancementJobQueue queue;
        private final String jobId;
        private final CancellationToken token;

        QueueMonitor(long gen, EnhancementKind kind, EnhancementJobQueue queue, String jobId, CancellationToken token) {
            this.gen = gen;
            this.kind = kind;
            this.queue = queue;
            this.jobId = jobId;
            this.token = token;
        }

        @Override
        public void run() {
            Instant startedAt = Instant.now();
            EnhancementRunStatus outcome = EnhancementRunStatus.STOPPED;
            String error = null;
            int processed = 0;
            int total = 0;
            try {
                while (!token.isCancelled()) {
                    Optional<QueuedJobStatus> status = queue.status(jobId);
                    if (status.isEmpty()) {
                        outcome = EnhancementRunStatus.ERROR;
                        error = "Queued job " + jobId + " is no longer known to the queue";
                        break;
                    }
                    QueuedJobStatus s = status.get();
                    processed = s.processed();
                    total = s.total();
                    if (s.state().isTerminal()) {
                        progressTracker.mirror(gen, EnhancementRunStatus.PROCESSING, processed, total);
                        outcome = toRunStatus(s.state());
                        error = s.error();
                        break;
                    }
                    progressTracker.mirror(gen, toRunStatus(s.state()), processed, total);
                    Thread.sleep(properties.getMonitorPollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                outcome = EnhancementRunStatus.ERROR;
                error = e.getMessage();
                log.error("Monitoring of job {} failed: {}", jobId, e.getMessage(), e);
            } finally {
                progressTracker.finish(gen, outcome, error);
                log.info("Queued {} enhancement job {} ended {}", kind.value(), jobId, outcome.value());
                writeRunLog(kind, outcome, processed, total, startedAt, error);
            }
        }
    }

    static EnhancementRunStatus toRunStatus(QueuedJobState state) {
        return switch (state) {
            case PENDING -> EnhancementRunStatus.QUEUED;
            case PROCESSING -> EnhancementRunStatus.PROCESSING;
            case COMPLETED -> EnhancementRunStatus.COMPLETED;
            case FAILED -> EnhancementRunStatus.ERROR;
            case CANCELLED -> EnhancementRunStatus.STOPPED;
        };
    }
}
