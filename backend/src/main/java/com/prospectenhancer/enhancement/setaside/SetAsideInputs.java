package com.prospectenhancer.enhancement.setaside;

import com.prospectenhancer.domain.ProspectEligibility;

import java.util.Map;
import java.util.Set;

/**
 * Combines the set-aside column with the small business program some sources keep in the side channel.
 */
public final class SetAsideInputs {

    static final String SET_ASIDE_LABEL = "Set-aside: ";
    static final String PROGRAM_LABEL = "Small Business Program: ";
    static final String PART_SEPARATOR = "; ";

    private static final Set<String> IGNORED_PROGRAM_VALUES = Set.of("none", "n/a", "tbd", "");

    private SetAsideInputs() {
    }

    /**
     * @return the text to classify, or an empty string when neither source carries information
     */
    public static String comprehensive(String setAside, Map<String, Object> extra) {
        String main = setAside == null ? "" : setAside.strip();
        String program = program(extra);
        if (!main.isEmpty() && !program.isEmpty()) {
            return main.equalsIgnoreCase(program)
                    ? main
                    : SET_ASIDE_LABEL + main + PART_SEPARATOR + PROGRAM_LABEL + program;
        }
        if (!main.isEmpty()) {
            return main;
        }
        if (!program.isEmpty()) {
            return PROGRAM_LABEL + program;
        }
        return "";
    }

    private static String program(Map<String, Object> extra) {
        if (extra == null) {
            return "";
        }
        Object value = extra.get(ProspectEligibility.SMALL_BUSINESS_PROGRAM_KEY);
        if (value == null) {
            return "";
        }
        String text = String.valueOf(value).strip();
        return IGNORED_PROGRAM_VALUES.contains(text.toLowerCase()) ? "" : text;
    }
}
