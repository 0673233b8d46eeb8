package com.prospectenhancer.cleanup;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Recovery of prospects left IN_PROGRESS by a crashed or abandoned worker.
 */
@ConfigurationProperties(prefix = "prospect-enhancer.cleanup")
@NoArgsConstructor
@Getter
@Setter
public class CleanupProperties {

    /** IN_PROGRESS prospects older than this are considered stuck. */
    private Duration staleAfter = Duration.ofHours(1);

    /** How often (ms) the stale sweep runs. */
    private long intervalMs = 900_000;

    /** Reset every IN_PROGRESS prospect when the application starts. */
    private boolean resetOnStartup = true;
}
