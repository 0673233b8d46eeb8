package com.prospectenhancer.enhancement.queue;

import com.prospectenhancer.domain.EnhancementKind;
import com.prospectenhancer.domain.EnhancementStatus;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.domain.ProspectRepository;
import com.prospectenhancer.enhancement.config.EnhancementProperties;
import com.prospectenhancer.enhancement.engine.EnhancementEngine;
import com.prospectenhancer.enhancement.engine.EnhancementOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class InProcessEnhancementJobQueueTest {

    private static final EnhancementOutcome TITLE_DONE = new EnhancementOutcome(false, false, true, false);
    private static final EnhancementOutcome NOTHING = new EnhancementOutcome(false, false, false, false);

    @Mock
    ProspectRepository prospectRepository;
    @Mock
    EnhancementEngine enhancementEngine;

    private final AtomicLong nanos = new AtomicLong();
    private InProcessEnhancementJobQueue queue;

    @BeforeEach
    void setUp() {
        EnhancementProperties properties = new EnhancementProperties();
        properties.setFinishedJobRetention(Duration.ofMinutes(30));
        queue = new InProcessEnhancementJobQueue(prospectRepository, enhancementEngine, properties, Runnable::run,
                nanos::get);
        when(prospectRepository.save(any(Prospect.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Prospect stored(String id) {
        Prospect p = new Prospect();
        p.setId(id);
        p.setTitle("Title " + id);
        when(prospectRepository.findById(id)).thenReturn(Optional.of(p));
        return p;
    }

    @Test
    @DisplayName("individual job submitted after a bulk job runs first")
    void individualJumpsAheadOfPendingBulk() {
        Prospect a = stored("a");
        Prospect b = stored("b");
        Prospect c = stored("c");
        when(enhancementEngine.enhanceOne(any(Prospect.class), eq(EnhancementKind.TITLES), anyBoolean()))
                .thenReturn(TITLE_DONE);

        String bulkId = queue.submitBulk(List.of("a", "b"), EnhancementKind.TITLES, false, "worker");
        String individualId = queue.submitIndividual("c", EnhancementKind.TITLES, "user-1");

        assertThat(queue.drainOne()).isTrue();
        assertThat(queue.status(individualId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(queue.status(bulkId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.PENDING);

        assertThat(queue.drainOne()).isTrue();
        assertThat(queue.drainOne()).isFalse();

        InOrder order = inOrder(enhancementEngine);
        order.verify(enhancementEngine).enhanceOne(c, EnhancementKind.TITLES, true);
        order.verify(enhancementEngine).enhanceOne(a, EnhancementKind.TITLES, false);
        order.verify(enhancementEngine).enhanceOne(b, EnhancementKind.TITLES, false);

        QueuedJobStatus bulk = queue.status(bulkId).orElseThrow();
        assertThat(bulk.state()).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(bulk.processed()).isEqualTo(2);
        assertThat(bulk.total()).isEqualTo(2);
        assertThat(bulkId).startsWith("bulk_titles_");
        assertThat(individualId).startsWith("individual_c_");
    }

    @Test
    @DisplayName("bulk job skips missing and in-progress prospects and counts only enhanced ones")
    void bulkSkipsBusyRecords() {
        Prospect free = stored("free");
        Prospect busy = stored("busy");
        busy.markInProgress("someone-else", Instant.now());
        Prospect unchanged = stored("unchanged");
        when(prospectRepository.findById("gone")).thenReturn(Optional.empty());
        when(enhancementEngine.enhanceOne(free, EnhancementKind.VALUES, true)).thenReturn(TITLE_DONE);
        when(enhancementEngine.enhanceOne(unchanged, EnhancementKind.VALUES, true)).thenReturn(NOTHING);

        String jobId = queue.submitBulk(List.of("free", "busy", "gone", "unchanged"), EnhancementKind.VALUES, true, "worker");
        queue.drainOne();

        verify(enhancementEngine, never()).enhanceOne(eq(busy), any(), anyBoolean());
        verify(prospectRepository).save(free);
        verify(prospectRepository, never()).save(unchanged);
        QueuedJobStatus status = queue.status(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(status.processed()).isEqualTo(1);
        assertThat(status.total()).isEqualTo(4);
    }

    @Test
    @DisplayName("one failing prospect does not fail the bulk job")
    void bulkContinuesAfterFailure() {
        Prospect first = stored("first");
        Prospect second = stored("second");
        when(enhancementEngine.enhanceOne(first, EnhancementKind.NAICS, false)).thenThrow(new IllegalStateException("boom"));
        when(enhancementEngine.enhanceOne(second, EnhancementKind.NAICS, false)).thenReturn(TITLE_DONE);

        String jobId = queue.submitBulk(List.of("first", "second"), EnhancementKind.NAICS, false, "worker");
        queue.drainOne();

        QueuedJobStatus status = queue.status(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(status.processed()).isEqualTo(1);
    }

    @Test
    @DisplayName("cancelling a pending job marks it cancelled and the worker skips it")
    void cancelPending() {
        stored("a");
        String jobId = queue.submitBulk(List.of("a"), EnhancementKind.TITLES, false, "worker");

        assertThat(queue.cancel(jobId)).isTrue();
        assertThat(queue.status(jobId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.CANCELLED);
        assertThat(queue.drainOne()).isTrue();

        verify(enhancementEngine, never()).enhanceOne(any(), any(), anyBoolean());
        assertThat(queue.cancel(jobId)).isFalse();
    }

    @Test
    @DisplayName("cancel and status of an unknown job")
    void unknownJob() {
        assertThat(queue.cancel("nope")).isFalse();
        assertThat(queue.status("nope")).isEmpty();
    }

    @Test
    @DisplayName("individual job marks the prospect in progress then releases it")
    void individualMarksAndReleases() {
        Prospect p = stored("p1");
        when(enhancementEngine.enhanceOne(p, EnhancementKind.ALL, true)).thenAnswer(inv -> {
            Prospect during = inv.getArgument(0);
            assertThat(during.getEnhancementStatus()).isEqualTo(EnhancementStatus.IN_PROGRESS);
            assertThat(during.getEnhancementUserId()).isEqualTo("user-7");
            return TITLE_DONE;
        });

        String jobId = queue.submitIndividual("p1", EnhancementKind.ALL, "user-7");
        queue.drainOne();

        assertThat(p.getEnhancementStatus()).isEqualTo(EnhancementStatus.IDLE);
        assertThat(p.getEnhancementUserId()).isNull();
        QueuedJobStatus status = queue.status(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(status.processed()).isEqualTo(1);
    }

    @Test
    @DisplayName("individual job failure marks the prospect failed and records the error")
    void individualFailure() {
        Prospect p = stored("p2");
        when(enhancementEngine.enhanceOne(any(Prospect.class), any(), anyBoolean()))
                .thenThrow(new IllegalStateException("model down"));

        String jobId = queue.submitIndividual("p2", EnhancementKind.TITLES, "user-1");
        queue.drainOne();

        assertThat(p.getEnhancementStatus()).isEqualTo(EnhancementStatus.FAILED);
        QueuedJobStatus status = queue.status(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(QueuedJobState.FAILED);
        assertThat(status.error()).isEqualTo("model down");
    }

    @Test
    @DisplayName("individual job for a missing prospect fails without touching the engine")
    void individualMissing() {
        when(prospectRepository.findById(anyString())).thenReturn(Optional.empty());

        String jobId = queue.submitIndividual("ghost", EnhancementKind.TITLES, "user-1");
        queue.drainOne();

        QueuedJobStatus status = queue.status(jobId).orElseThrow();
        assertThat(status.state()).isEqualTo(QueuedJobState.FAILED);
        assertThat(status.error()).isEqualTo("Prospect ghost not found");
        verify(enhancementEngine, never()).enhanceOne(any(), any(), anyBoolean());
    }

    @Test
    @DisplayName("finished and cancelled jobs stop being reported after the retention period")
    void finishedJobsExpire() {
        Prospect p = stored("p3");
        when(enhancementEngine.enhanceOne(p, EnhancementKind.TITLES, true)).thenReturn(TITLE_DONE);
        String doneId = queue.submitIndividual("p3", EnhancementKind.TITLES, "user-1");
        queue.drainOne();
        String cancelledId = queue.submitBulk(List.of("p3"), EnhancementKind.TITLES, false, "worker");
        queue.cancel(cancelledId);

        nanos.addAndGet(Duration.ofMinutes(29).toNanos());
        assertThat(queue.status(doneId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.COMPLETED);
        assertThat(queue.status(cancelledId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.CANCELLED);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        assertThat(queue.status(doneId)).isEmpty();
        assertThat(queue.status(cancelledId)).isEmpty();
        assertThat(queue.cancel(doneId)).isFalse();
    }

    @Test
    @DisplayName("pending jobs are reported for as long as they wait, regardless of retention")
    void pendingJobsDoNotExpire() {
        stored("p4");
        String jobId = queue.submitBulk(List.of("p4"), EnhancementKind.VALUES, false, "worker");

        nanos.addAndGet(Duration.ofHours(5).toNanos());

        assertThat(queue.status(jobId)).get().extracting(QueuedJobStatus::state).isEqualTo(QueuedJobState.PENDING);
    }
}
