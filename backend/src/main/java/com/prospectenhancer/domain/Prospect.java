package com.prospectenhancer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contracting opportunity loaded from an agency source; the unit of enhancement.
 * Created by the surrounding application, enriched in place by the enhancement pipeline.
 */
@Document(collection = "prospects")
@CompoundIndex(name = "enhancement_status_started", def = "{'enhancementStatus': 1, 'enhancementStartedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Prospect {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String nativeId;
    private String title;
    private String aiEnhancedTitle;
    private String description;
    private String agency;
    private String contractType;

    private String naics;
    private String naicsDescription;
    private NaicsSource naicsSource;

    /** Numeric value as delivered by the source, when it had one. */
    private BigDecimal estimatedValue;
    private String estimatedValueText;
    /** Either single is set, or min/max are set; never both. */
    private BigDecimal estimatedValueSingle;
    private BigDecimal estimatedValueMin;
    private BigDecimal estimatedValueMax;

    private String setAside;
    /** Standardized set-aside code, e.g. SMALL_BUSINESS. */
    private String setAsideStandardized;
    private String setAsideStandardizedLabel;

    @Indexed
    private Instant loadedAt;
    private Instant ollamaProcessedAt;
    private String ollamaModelVersion;

    private EnhancementStatus enhancementStatus = EnhancementStatus.IDLE;
    private Instant enhancementStartedAt;
    private String enhancementUserId;

    /** Source-specific fields not mapped to first-class attributes. */
    private Map<String, Object> extra = new LinkedHashMap<>();

    public Map<String, Object> getExtra() {
        if (extra == null) {
            extra = new LinkedHashMap<>();
        }
        return extra;
    }

    public boolean hasParsedValue() {
        return estimatedValueSingle != null || estimatedValueMin != null || estimatedValueMax != null;
    }

    public void markInProgress(String ownerId, Instant now) {
        this.enhancementStatus = EnhancementStatus.IN_PROGRESS;
        this.enhancementStartedAt = now;
        this.enhancementUserId = ownerId;
    }

    public void markIdle() {
        this.enhancementStatus = EnhancementStatus.IDLE;
        this.enhancementStartedAt = null;
        this.enhancementUserId = null;
    }

    public void markFailed() {
        this.enhancementStatus = EnhancementStatus.FAILED;
        this.enhancementStartedAt = null;
        this.enhancementUserId = null;
    }
}
