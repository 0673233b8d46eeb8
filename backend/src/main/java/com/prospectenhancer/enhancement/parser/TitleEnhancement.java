package com.prospectenhancer.enhancement.parser;

/**
 * Model-proposed title. {@code enhancedTitle} is null when the model offered nothing new.
 */
public record TitleEnhancement(String enhancedTitle, double confidence, String reasoning) {

    private static final TitleEnhancement NONE = new TitleEnhancement(null, 0.0, null);

    public static TitleEnhancement none() {
        return NONE;
    }

    public boolean isEnhanced() {
        return enhancedTitle != null;
    }
}
