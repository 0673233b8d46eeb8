package com.prospectenhancer.enhancement.audit;

/**
 * Audit log name of each kind of model interaction.
 */
public enum ModelInteractionType {
    VALUE_PARSING("value_parsing"),
    NAICS_CLASSIFICATION("naics_classification"),
    TITLE_ENHANCEMENT("title_enhancement"),
    SET_ASIDE_STANDARDIZATION("set_aside_standardization");

    private final String value;

    ModelInteractionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
