package com.prospectenhancer.cleanup;

import com.prospectenhancer.domain.EnhancementStatus;
import com.prospectenhancer.domain.ProspectRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnhancementCleanupSweepTest {

    @Mock
    ProspectRepository prospectRepository;

    private CleanupProperties properties;
    private EnhancementCleanupSweep sweep;

    @BeforeEach
    void setUp() {
        properties = new CleanupProperties();
        sweep = new EnhancementCleanupSweep(prospectRepository, properties);
    }

    @Test
    @DisplayName("startup reset releases every in-progress prospect regardless of age")
    void startupResetsAll() {
        when(prospectRepository.resetInProgress(isNull())).thenReturn(3L);

        sweep.onApplicationReady();

        verify(prospectRepository).resetInProgress(isNull());
    }

    @Test
    @DisplayName("startup reset is skipped when disabled")
    void startupResetDisabled() {
        properties.setResetOnStartup(false);

        sweep.onApplicationReady();

        verifyNoInteractions(prospectRepository);
    }

    @Test
    @DisplayName("stale reset uses now minus max age as the cutoff")
    void resetStaleCutoff() {
        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        when(prospectRepository.resetInProgress(cutoff.capture())).thenReturn(2L);

        long reset = sweep.resetStale(Duration.ofMinutes(30));

        assertThat(reset).isEqualTo(2L);
        assertThat(cutoff.getValue()).isCloseTo(Instant.now().minus(Duration.ofMinutes(30)), within(5, ChronoUnit.SECONDS));
    }

    @Test
    @DisplayName("scheduled sweep uses the configured stale age and survives repository failures")
    void scheduledSweep() {
        properties.setStaleAfter(Duration.ofHours(2));
        ArgumentCaptor<Instant> cutoff = ArgumentCaptor.forClass(Instant.class);
        when(prospectRepository.resetInProgress(cutoff.capture())).thenThrow(new IllegalStateException("mongo down"));

        assertThatCode(sweep::runScheduled).doesNotThrowAnyException();

        assertThat(cutoff.getValue()).isBefore(Instant.now().minus(Duration.ofMinutes(119)));
        verify(prospectRepository, never()).resetInProgress(isNull());
    }

    @Test
    @DisplayName("statistics count each status and the long-running prospects")
    void statistics() {
        when(prospectRepository.countByEnhancementStatus(EnhancementStatus.IDLE)).thenReturn(10L);
        when(prospectRepository.countByEnhancementStatus(EnhancementStatus.IN_PROGRESS)).thenReturn(3L);
        when(prospectRepository.countByEnhancementStatus(EnhancementStatus.FAILED)).thenReturn(1L);
        when(prospectRepository.countInProgressStartedBefore(any(Instant.class))).thenReturn(2L);
        when(prospectRepository.count()).thenReturn(14L);

        EnhancementStatistics stats = sweep.statistics();

        assertThat(stats).isEqualTo(new EnhancementStatistics(10, 3, 1, 2, 14));
    }
}
