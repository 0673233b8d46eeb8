package com.prospectenhancer.domain;

/**
 * Provenance of a prospect's NAICS code.
 */
public enum NaicsSource {
    /** Came with the source data (first-class column or side channel). */
    ORIGINAL,
    LLM_INFERRED,
    STANDARDIZED
}
