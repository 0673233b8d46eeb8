package com.prospectenhancer.enhancement.queue;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.prospectenhancer.config.AsyncConfig;
import com.prospectenhancer.domain.EnhancementKind;
import com.prospectenhancer.domain.EnhancementStatus;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.domain.ProspectRepository;
import com.prospectenhancer.enhancement.config.EnhancementProperties;
import com.prospectenhancer.enhancement.engine.EnhancementEngine;
import com.prospectenhancer.enhancement.engine.EnhancementOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-worker priority queue kept in memory. Individual requests jump ahead of pending bulk jobs but do
 * not interrupt a bulk job that is already running. Finished jobs stay queryable for
 * {@code finished-job-retention}. Job state is lost on restart; the cleanup sweep releases any prospects
 * left in progress.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "prospect-enhancer.queue", name = "enabled", havingValue = "true")
public class InProcessEnhancementJobQueue implements EnhancementJobQueue {

    private final PriorityBlockingQueue<QueuedJob> pending = new PriorityBlockingQueue<>();
    /** Pending and running jobs; moved to {@link #finished} once terminal. */
    private final Map<String, QueuedJob> jobs = new ConcurrentHashMap<>();
    private final Cache<String, QueuedJob> finished;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean workerStarted = new AtomicBoolean(false);

    private final ProspectRepository prospectRepository;
    private final EnhancementEngine enhancementEngine;
    private final Executor jobQueueExecutor;

    @Autowired
    public InProcessEnhancementJobQueue(ProspectRepository prospectRepository, EnhancementEngine enhancementEngine,
                                        EnhancementProperties properties,
                                        @Qualifier(AsyncConfig.JOB_QUEUE_EXECUTOR) Executor jobQueueExecutor) {
        this(prospectRepository, enhancementEngine, properties, jobQueueExecutor, Ticker.systemTicker());
    }

    InProcessEnhancementJobQueue(ProspectRepository prospectRepository, EnhancementEngine enhancementEngine,
                                 EnhancementProperties properties, Executor jobQueueExecutor, Ticker ticker) {
        this.prospectRepository = prospectRepository;
        this.enhancementEngine = enhancementEngine;
        this.jobQueueExecutor = jobQueueExecutor;
        this.finished = Caffeine.newBuilder()
                .expireAfterWrite(properties.getFinishedJobRetention())
                .ticker(ticker)
                .build();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (workerStarted.compareAndSet(false, true)) {
            jobQueueExecutor.execute(this::workerLoop);
            log.info("Enhancement job queue worker started");
        }
    }

    @Override
    public String submitBulk(List<String> prospectIds, EnhancementKind kind, boolean force, String ownerId) {
        QueuedJob job = register("bulk_" + kind.value(), kind, prospectIds, force, false, ownerId);
        log.info("Queued bulk job {} for {} prospects", job.id(), prospectIds.size());
        return job.id();
    }

    @Override
    public String submitIndividual(String prospectId, EnhancementKind kind, String ownerId) {
        QueuedJob job = register("individual_" + prospectId, kind, List.of(prospectId), true, true, ownerId);
        log.info("Queued individual job {} for prospect {}", job.id(), prospectId);
        return job.id();
    }

    @Override
    public Optional<QueuedJobStatus> status(String jobId) {
        QueuedJob job = jobs.get(jobId);
        if (job == null) {
            job = finished.getIfPresent(jobId);
        }
        return Optional.ofNullable(job).map(QueuedJob::status);
    }

    @Override
    public boolean cancel(String jobId) {
        QueuedJob job = jobs.get(jobId);
        if (job == null || job.state().isTerminal()) {
            return false;
        }
        job.requestCancel();
        if (job.state() == QueuedJobState.PENDING) {
            job.state(QueuedJobState.CANCELLED);
            retire(job);
        }
        log.info("Cancel requested for job {}", jobId);
        return true;
    }

    private QueuedJob register(String prefix, EnhancementKind kind, List<String> ids, boolean force,
                               boolean individual, String ownerId) {
        long seq = sequence.incrementAndGet();
        String id = prefix + "_" + System.currentTimeMillis();
        if (jobs.containsKey(id) || finished.getIfPresent(id) != null) {
            id = id + "_" + seq;
        }
        QueuedJob job = new QueuedJob(id, kind, ids, force, individual, ownerId, seq);
        jobs.put(id, job);
        pending.offer(job);
        return job;
    }

    private void workerLoop() {
        while (true) {
            try {
                process(pending.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Enhancement job queue worker interrupted, exiting");
                return;
            }
        }
    }

    /**
     * Runs the next queued job in the calling thread.
     *
     * @return false if nothing was queued
     */
    boolean drainOne() {
        QueuedJob job = pending.poll();
        if (job == null) {
            return false;
        }
        process(job);
        return true;
    }

    private void process(QueuedJob job) {
        if (job.state().isTerminal()) {
            return;
        }
        job.state(QueuedJobState.PROCESSING);
        try {
            if (job.individual()) {
                processIndividual(job);
            } else {
                processBulk(job);
            }
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", job.id(), e.getMessage(), e);
            job.fail(e.getMessage());
        } finally {
            retire(job);
        }
    }

    private void retire(QueuedJob job) {
        if (job.state().isTerminal() && jobs.remove(job.id(), job)) {
            finished.put(job.id(), job);
        }
    }

    private void processIndividual(QueuedJob job) {
        String prospectId = job.prospectIds().get(0);
        Optional<Prospect> found = prospectRepository.findById(prospectId);
        if (found.isEmpty()) {
            job.fail("Prospect " + prospectId + " not found");
            return;
        }
        Prospect prospect = found.get();
        prospect.markInProgress(job.ownerId(), Instant.now());
        prospectRepository.save(prospect);
        try {
            EnhancementOutcome outcome = enhancementEngine.enhanceOne(prospect, job.kind(), job.force());
            prospect.markIdle();
            prospectRepository.save(prospect);
            if (outcome.anySucceeded()) {
                job.incrementProcessed();
            }
            job.state(QueuedJobState.COMPLETED);
        } catch (RuntimeException e) {
            log.error("Individual job {} failed for prospect {}: {}", job.id(), prospectId, e.getMessage(), e);
            prospectRepository.findById(prospectId).ifPresent(stored -> {
                stored.markFailed();
                prospectRepository.save(stored);
            });
            job.fail(e.getMessage());
        }
    }

    private void processBulk(QueuedJob job) {
        int failed = 0;
        for (String prospectId : job.prospectIds()) {
            if (job.isCancelRequested()) {
                job.state(QueuedJobState.CANCELLED);
                log.info("Bulk job {} cancelled after {} prospects", job.id(), job.status().processed());
                return;
            }
            Optional<Prospect> found = prospectRepository.findById(prospectId);
            if (found.isEmpty()) {
                log.debug("Bulk job {}: prospect {} no longer exists", job.id(), prospectId);
                continue;
            }
            Prospect prospect = found.get();
            if (prospect.getEnhancementStatus() == EnhancementStatus.IN_PROGRESS) {
                log.debug("Bulk job {}: prospect {} is being enhanced elsewhere, skipping", job.id(), prospectId);
                continue;
            }
            try {
                EnhancementOutcome outcome = enhancementEngine.enhanceOne(prospect, job.kind(), job.force());
                if (outcome.anySucceeded()) {
                    prospectRepository.save(prospect);
                    job.incrementProcessed();
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Bulk job {} failed for prospect {}: {}", job.id(), prospectId, e.getMessage(), e);
            }
        }
        job.state(QueuedJobState.COMPLETED);
        log.info("Bulk job {} completed: {} of {} prospects enhanced, {} failed",
                job.id(), job.status().processed(), job.prospectIds().size(), failed);
    }
}
