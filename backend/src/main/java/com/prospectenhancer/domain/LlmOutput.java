package com.prospectenhancer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One model invocation: prompt, raw response and what was parsed from it. Append-only.
 */
@Document(collection = "llm_outputs")
@CompoundIndex(name = "prospect_type_ts", def = "{'prospectId': 1, 'enhancementType': 1, 'timestamp': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LlmOutput {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String prospectId;
    /** value_parsing, naics_classification, title_enhancement or set_aside_standardization. */
    private String enhancementType;
    private String prompt;
    private String response;
    private Map<String, Object> parsedResult;
    private boolean success;
    private String errorMessage;
    private Long processingTimeMs;
    private Instant timestamp;
}
