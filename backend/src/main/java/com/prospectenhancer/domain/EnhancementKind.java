package com.prospectenhancer.domain;

import java.util.Arrays;

/**
 * What an enhancement run works on. {@link #ALL} expands to the four concrete kinds.
 */
public enum EnhancementKind {
    VALUES("values"),
    NAICS("naics"),
    TITLES("titles"),
    SET_ASIDES("set_asides"),
    ALL("all");

    private final String value;

    EnhancementKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean includes(EnhancementKind concrete) {
        return this == ALL || this == concrete;
    }

    /**
     * Parses the external name ("values", "set_asides", ...). Case-insensitive.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static EnhancementKind fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Enhancement kind is required");
        }
        String normalized = raw.strip().toLowerCase();
        return Arrays.stream(values())
                .filter(k -> k.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown enhancement kind: " + raw));
    }
}
