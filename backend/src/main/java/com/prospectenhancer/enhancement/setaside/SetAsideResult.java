package com.prospectenhancer.enhancement.setaside;

/**
 * Standardized category for one set-aside input, with how it was decided.
 */
public record SetAsideResult(StandardSetAside category, double confidence, Method method, String input) {

    public enum Method {
        EXACT,
        PATTERN,
        DEFAULT,
        MODEL
    }
}
