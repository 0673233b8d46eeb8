package com.prospectenhancer.enhancement.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Batch and iterative enhancement runs.
 */
@ConfigurationProperties(prefix = "prospect-enhancer.enhancement")
@NoArgsConstructor
@Getter
@Setter
public class EnhancementProperties {

    /** Records per chunk in a batch run. */
    private int batchSize = 50;

    /** Successful records accumulated before a batch run flushes them to the store. */
    private int commitBatchSize = 100;

    /** How long stop() waits for the worker to finish its in-flight record. */
    private Duration stopTimeout = Duration.ofSeconds(10);

    /** Poll interval of the monitor that mirrors a queued job into progress. */
    private Duration monitorPollInterval = Duration.ofSeconds(1);

    /** Below this standardizer confidence the model is asked to classify the set-aside. */
    private double setAsideModelConsultThreshold = 0.7;

    private long setAsideCacheSize = 5_000;

    private Duration setAsideCacheTtl = Duration.ofHours(24);

    /** How long the job queue keeps reporting status for a finished or cancelled job. */
    private Duration finishedJobRetention = Duration.ofHours(1);
}
