package com.prospectenhancer.enhancement.setaside;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of procurement set-aside categories. {@link #code()} is persisted, {@link #label()} is displayed.
 */
public enum StandardSetAside {
    SMALL_BUSINESS("Small Business"),
    SMALL_BUSINESS_TOTAL("Small Business Total"),
    EIGHT_A_COMPETITIVE("8(a) Competitive"),
    EIGHT_A_SOLE_SOURCE("8(a) Sole Source"),
    HUBZONE("HUBZone"),
    HUBZONE_SOLE_SOURCE("HUBZone Sole Source"),
    WOMEN_OWNED("Women-Owned"),
    EDWOSB("Economically Disadvantaged Women-Owned"),
    SDVOSB("Service-Disabled Veteran-Owned"),
    SDVOSB_SOLE_SOURCE("Service-Disabled Veteran-Owned Sole Source"),
    VETERAN_OWNED("Veteran-Owned"),
    SMALL_DISADVANTAGED("Small Disadvantaged"),
    FULL_AND_OPEN("Full and Open"),
    UNRESTRICTED("Unrestricted"),
    SOLE_SOURCE("Sole Source"),
    OTHER_THAN_SMALL("Other Than Small"),
    NOT_AVAILABLE("N/A");

    private final String label;

    StandardSetAside(String label) {
        this.label = label;
    }

    public String code() {
        return name();
    }

    public String label() {
        return label;
    }

    /** Case-insensitive match on label or code. */
    public static Optional<StandardSetAside> fromLabelOrCode(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String t = text.strip();
        return Arrays.stream(values())
                .filter(v -> v.label.equalsIgnoreCase(t) || v.name().equalsIgnoreCase(t))
                .findFirst();
    }
}
