package com.prospectenhancer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Summary written once at the end of every iterative run, whatever its outcome.
 */
@Document(collection = "ai_enrichment_logs")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class EnrichmentRunLog {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String enhancementType;
    private String status;
    private int processedCount;
    private double durationSeconds;
    private String message;
    private String error;
    private Instant timestamp;
}
