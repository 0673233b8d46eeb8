package com.prospectenhancer.cleanup;

import com.prospectenhancer.domain.EnhancementStatus;
import com.prospectenhancer.domain.ProspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Returns stuck IN_PROGRESS prospects to IDLE: all of them at startup (no worker can own them yet),
 * and periodically those older than {@code prospect-enhancer.cleanup.stale-after}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EnhancementCleanupSweep {

    private final ProspectRepository prospectRepository;
    private final CleanupProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isResetOnStartup()) {
            return;
        }
        long reset = resetAllInProgress();
        if (reset > 0) {
            log.info("Startup cleanup reset {} prospect(s) left in progress", reset);
        }
    }

    @Scheduled(
            fixedDelayString = "${prospect-enhancer.cleanup.interval-ms:900000}",
            initialDelayString = "${prospect-enhancer.cleanup.interval-ms:900000}")
    public void runScheduled() {
        try {
            long reset = resetStale(properties.getStaleAfter());
            if (reset > 0) {
                log.info("Stale sweep reset {} prospect(s) in progress longer than {}", reset, properties.getStaleAfter());
            }
        } catch (RuntimeException e) {
            log.error("Stale sweep failed: {}", e.getMessage(), e);
        }
    }

    /** @return number of prospects reset */
    public long resetAllInProgress() {
        return prospectRepository.resetInProgress(null);
    }

    /**
     * Resets IN_PROGRESS prospects started more than {@code maxAge} ago, or with no start timestamp.
     *
     * @return number of prospects reset
     */
    public long resetStale(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        long reset = prospectRepository.resetInProgress(cutoff);
        log.debug("Reset {} prospect(s) started before {}", reset, cutoff);
        return reset;
    }

    public EnhancementStatistics statistics() {
        long idle = prospectRepository.countByEnhancementStatus(EnhancementStatus.IDLE);
        long inProgress = prospectRepository.countByEnhancementStatus(EnhancementStatus.IN_PROGRESS);
        long failed = prospectRepository.countByEnhancementStatus(EnhancementStatus.FAILED);
        long longRunning = prospectRepository.countInProgressStartedBefore(
                Instant.now().minus(properties.getStaleAfter()));
        return new EnhancementStatistics(idle, inProgress, failed, longRunning, prospectRepository.count());
    }
}
