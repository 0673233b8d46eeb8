package com.prospectenhancer.enhancement.job;

import com.prospectenhancer.domain.EnhancementKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EnhancementProgressTrackerTest {

    private EnhancementProgressTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new EnhancementProgressTracker();
    }

    @Test
    @DisplayName("fresh tracker is idle with no counters")
    void initiallyIdle() {
        EnhancementProgress progress = tracker.snapshot();

        assertThat(progress.status()).isEqualTo(EnhancementRunStatus.IDLE);
        assertThat(progress.processed()).isZero();
        assertThat(tracker.isActive()).isFalse();
    }

    @Test
    @DisplayName("begin resets counters and errors from the previous run")
    void beginResets() {
        long first = tracker.begin(EnhancementKind.TITLES, 5, EnhancementRunStatus.PROCESSING, null);
        tracker.recordSuccess(first);
        tracker.recordError(first, "p9", "boom");
        tracker.finish(first, EnhancementRunStatus.COMPLETED, null);

        tracker.begin(EnhancementKind.NAICS, 3, EnhancementRunStatus.PROCESSING, null);
        EnhancementProgress progress = tracker.snapshot();

        assertThat(progress.currentType()).isEqualTo("naics");
        assertThat(progress.processed()).isZero();
        assertThat(progress.total()).isEqualTo(3);
        assertThat(progress.errors()).isEmpty();
        assertThat(progress.startedAt()).isNotNull();
    }

    @Test
    @DisplayName("current record title is cut to 100 characters, missing title is Untitled")
    void currentRecordTitle() {
        long gen = tracker.begin(EnhancementKind.ALL, 2, EnhancementRunStatus.PROCESSING, null);

        tracker.setCurrent(gen, "p1", "x".repeat(150));
        assertThat(tracker.snapshot().currentRecord().title()).hasSize(EnhancementProgressTracker.TITLE_LIMIT);

        tracker.setCurrent(gen, "p2", null);
        assertThat(tracker.snapshot().currentRecord()).isEqualTo(new EnhancementProgress.CurrentRecord("p2", "Untitled"));
    }

    @Test
    @DisplayName("updates from an older generation are ignored")
    void staleGenerationIgnored() {
        long old = tracker.begin(EnhancementKind.VALUES, 10, EnhancementRunStatus.PROCESSING, null);
        tracker.forceStopped();
        long current = tracker.begin(EnhancementKind.VALUES, 4, EnhancementRunStatus.PROCESSING, null);

        tracker.recordSuccess(old);
        tracker.finish(old, EnhancementRunStatus.COMPLETED, null);
        tracker.recordSuccess(current);

        EnhancementProgress progress = tracker.snapshot();
        assertThat(progress.status()).isEqualTo(EnhancementRunStatus.PROCESSING);
        assertThat(progress.processed()).isEqualTo(1);
        assertThat(tracker.snapshot(old)).isNull();
    }

    @Test
    @DisplayName("finish after force stop keeps STOPPED")
    void finishAfterForceStop() {
        long gen = tracker.begin(EnhancementKind.VALUES, 1, EnhancementRunStatus.PROCESSING, null);

        assertThat(tracker.forceStopped().status()).isEqualTo(EnhancementRunStatus.STOPPED);
        tracker.finish(gen, EnhancementRunStatus.COMPLETED, null);

        assertThat(tracker.snapshot().status()).isEqualTo(EnhancementRunStatus.STOPPED);
    }

    @Test
    @DisplayName("finish with an error keeps the message")
    void finishWithError() {
        long gen = tracker.begin(EnhancementKind.VALUES, 1, EnhancementRunStatus.QUEUED, "bulk_values_1");
        tracker.mirror(gen, EnhancementRunStatus.PROCESSING, 1, 1);

        tracker.finish(gen, EnhancementRunStatus.ERROR, "store unavailable");

        EnhancementProgress progress = tracker.snapshot();
        assertThat(progress.status()).isEqualTo(EnhancementRunStatus.ERROR);
        assertThat(progress.errorMessage()).isEqualTo("store unavailable");
        assertThat(progress.jobId()).isEqualTo("bulk_values_1");
        assertThat(progress.processed()).isEqualTo(1);
    }
}
