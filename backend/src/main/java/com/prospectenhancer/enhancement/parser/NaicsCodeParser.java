package com.prospectenhancer.enhancement.parser;

import com.prospectenhancer.common.NaicsCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses NAICS text in the formats agency sources deliver it:
 * <ul>
 *   <li>{@code 334516 | Description} (pipe)</li>
 *   <li>{@code 334516 : Description} (colon)</li>
 *   <li>{@code 334516 - Description} (hyphen)</li>
 *   <li>{@code 334516 Description} (space)</li>
 *   <li>{@code 334516} (code only)</li>
 *   <li>{@code 334516.0} (spreadsheet numeric)</li>
 * </ul>
 * Patterns are tried in that order against the start of the text.
 */
@Component
@RequiredArgsConstructor
public class NaicsCodeParser {

    private static final Pattern NUMERIC_WITH_DECIMAL = Pattern.compile("^[1-9]\\d{5}\\.0+$");

    private static final List<FormatPattern> FORMATS = List.of(
            new FormatPattern("pipe", Pattern.compile("(\\d{6})\\s*\\|\\s*(.*)", Pattern.DOTALL)),
            new FormatPattern("colon", Pattern.compile("(\\d{6})\\s*:\\s*(.*)", Pattern.DOTALL)),
            new FormatPattern("hyphen", Pattern.compile("(\\d{6})\\s*-\\s*(.*)", Pattern.DOTALL)),
            new FormatPattern("space", Pattern.compile("(\\d{6})\\s+([^0-9].*)", Pattern.DOTALL)),
            new FormatPattern("code_only", Pattern.compile("(\\d{6})$"))
    );

    private final NaicsCatalog naicsCatalog;

    public NaicsParseResult parse(String raw) {
        if (raw == null) {
            return NaicsParseResult.none();
        }
        String text = raw.strip();
        if (text.isEmpty() || NaicsCatalog.isPlaceholder(text)) {
            return NaicsParseResult.none();
        }
        if (NUMERIC_WITH_DECIMAL.matcher(text).matches()) {
            text = text.substring(0, text.indexOf('.'));
        }
        for (FormatPattern format : FORMATS) {
            Matcher m = format.pattern().matcher(text);
            if (m.lookingAt()) {
                String code = m.group(1);
                String description = m.groupCount() > 1 ? blankToNull(m.group(2)) : null;
                if (description == null) {
                    description = naicsCatalog.describe(code).orElse(null);
                }
                return NaicsParseResult.of(code, description, format.name());
            }
        }
        String description = naicsCatalog.isValid(text) ? naicsCatalog.describe(text).orElse(null) : null;
        return NaicsParseResult.of(text, description, "unknown");
    }

    private static String blankToNull(String s) {
        if (s == null) {
            return null;
        }
        String stripped = s.strip();
        return stripped.isEmpty() ? null : stripped;
    }

    private record FormatPattern(String name, Pattern pattern) {
    }
}
