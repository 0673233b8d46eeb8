package com.prospectenhancer.enhancement.job;

import com.prospectenhancer.domain.EnhancementKind;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.domain.ProspectRepository;
import com.prospectenhancer.enhancement.config.EnhancementProperties;
import com.prospectenhancer.enhancement.engine.EnhancementEngine;
import com.prospectenhancer.enhancement.engine.EnhancementOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Enhances a fixed list of prospects synchronously in the caller's thread. Works in chunks, flushes
 * successes every {@code commitBatchSize} records and once at the end. A failing record never stops the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchEnhancementProcessor {

    private final EnhancementEngine enhancementEngine;
    private final ProspectRepository prospectRepository;
    private final EnhancementProperties properties;

    public int runBatch(List<Prospect> prospects, EnhancementKind kind) {
        return runBatch(prospects, kind, false);
    }

    /**
     * @param force re-process fields that already carry an enhancement
     * @return number of prospects enhanced and persisted
     */
    public int runBatch(List<Prospect> prospects, EnhancementKind kind, boolean force) {
        if (prospects == null || prospects.isEmpty()) {
            return 0;
        }
        int chunkSize = Math.max(1, properties.getBatchSize());
        int commitSize = Math.max(1, properties.getCommitBatchSize());
        log.info("Batch {} enhancement started for {} prospects (chunk {}, commit every {})",
                kind.value(), prospects.size(), chunkSize, commitSize);

        List<Prospect> pending = new ArrayList<>();
        int persisted = 0;
        int failed = 0;
        for (int from = 0; from < prospects.size(); from += chunkSize) {
            List<Prospect> chunk = prospects.subList(from, Math.min(from + chunkSize, prospects.size()));
            for (Prospect prospect : chunk) {
                try {
                    EnhancementOutcome outcome = enhancementEngine.enhanceOne(prospect, kind, force);
                    if (outcome.anySucceeded()) {
                        pending.add(prospect);
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Batch enhancement failed for prospect {}: {}", prospect.getId(), e.getMessage(), e);
                }
                if (pending.size() >= commitSize) {
                    persisted += flush(pending);
                }
            }
            log.debug("Batch {} chunk ending at {} done, {} persisted so far", kind.value(),
                    Math.min(from + chunkSize, prospects.size()), persisted);
        }
        persisted += flush(pending);
        log.info("Batch {} enhancement finished: {} of {} prospects enhanced, {} failed",
                kind.value(), persisted, prospects.size(), failed);
        return persisted;
    }

    /**
     * Loads up to {@code limit} eligible prospects (most recent first) and runs a batch over them.
     */
    public int runEligible(EnhancementKind kind, int limit) {
        List<Prospect> eligible = prospectRepository.findEligible(kind, true, limit);
        return runBatch(eligible, kind, false);
    }

    private int flush(List<Prospect> pending) {
        if (pending.isEmpty()) {
            return 0;
        }
        int size = pending.size();
        try {
            prospectRepository.saveAll(new ArrayList<>(pending));
            return size;
        } catch (RuntimeException e) {
            log.error("Failed to persist {} enhanced prospects: {}", size, e.getMessage(), e);
            return 0;
        } finally {
            pending.clear();
        }
    }
}
