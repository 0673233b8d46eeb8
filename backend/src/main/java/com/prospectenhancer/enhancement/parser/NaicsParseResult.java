package com.prospectenhancer.enhancement.parser;

/**
 * Parsed NAICS text. {@code standardizedText} is "code | description" when a description is known, else the code.
 */
public record NaicsParseResult(String code, String description, String standardizedText, String originalFormat) {

    private static final NaicsParseResult NONE = new NaicsParseResult(null, null, null, null);

    public static NaicsParseResult none() {
        return NONE;
    }

    public static NaicsParseResult of(String code, String description, String originalFormat) {
        String standardized = description != null ? code + " | " + description : code;
        return new NaicsParseResult(code, description, standardized, originalFormat);
    }

    public boolean hasCode() {
        return code != null;
    }

    /** True when the code has the shape of a NAICS code (six digits). */
    public boolean hasSixDigitCode() {
        return code != null && code.length() == 6 && code.chars().allMatch(Character::isDigit);
    }
}
