package com.prospectenhancer.enhancement.parser;

import com.prospectenhancer.common.NaicsCatalog;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The extraction rules known sources need. New sources add an entry to {@link #standard}.
 */
final class SideChannelRules {

    /** Generic keys seen across several sources. */
    static final List<String> GENERIC_KEYS = List.of("naics", "industry_code", "classification", "sector", "naics_primary");

    private static final Set<String> SKIPPED_VALUES = Set.of("TBD", "TO BE DETERMINED", "N/A", "NULL", "");
    private static final Pattern SIX_DIGITS = Pattern.compile("^\\d{6}$");
    private static final Pattern CODE_TOKEN = Pattern.compile("\\b(\\d{6})\\b");

    private SideChannelRules() {
    }

    static List<SideChannelRule> standard(NaicsCodeParser parser, NaicsCatalog catalog) {
        return List.of(
                new BareCodeKey("naics_code", catalog),
                new FormattedCodeKey("primary_naics", parser),
                new GenericKeys(GENERIC_KEYS, parser),
                new ValueScan(parser, catalog)
        );
    }

    private static String text(Object value) {
        return value == null ? null : String.valueOf(value).strip();
    }

    /** Key holding only a six-digit code (Acquisition Gateway style). */
    record BareCodeKey(String key, NaicsCatalog catalog) implements SideChannelRule {

        @Override
        public String name() {
            return key;
        }

        @Override
        public Optional<SideChannelMatch> extract(Map<String, Object> extra) {
            String value = text(extra.get(key));
            if (value == null || !SIX_DIGITS.matcher(value).matches()) {
                return Optional.empty();
            }
            return Optional.of(SideChannelMatch.found(value, catalog.describe(value).orElse(null), key));
        }
    }

    /** Key holding "code : description" or another parser format (HHS style). */
    record FormattedCodeKey(String key, NaicsCodeParser parser) implements SideChannelRule {

        @Override
        public String name() {
            return key;
        }

        @Override
        public Optional<SideChannelMatch> extract(Map<String, Object> extra) {
            String value = text(extra.get(key));
            if (value == null || value.isEmpty() || "TBD".equalsIgnoreCase(value)) {
                return Optional.empty();
            }
            NaicsParseResult parsed = parser.parse(value);
            return parsed.hasSixDigitCode()
                    ? Optional.of(SideChannelMatch.found(parsed.code(), parsed.description(), key))
                    : Optional.empty();
        }
    }

    record GenericKeys(List<String> keys, NaicsCodeParser parser) implements SideChannelRule {

        @Override
        public String name() {
            return "generic_keys";
        }

        @Override
        public Optional<SideChannelMatch> extract(Map<String, Object> extra) {
            for (String key : keys) {
                String value = text(extra.get(key));
                if (value == null || SKIPPED_VALUES.contains(value.toUpperCase())) {
                    continue;
                }
                NaicsParseResult parsed = parser.parse(value);
                if (parsed.hasSixDigitCode()) {
                    return Optional.of(SideChannelMatch.found(parsed.code(), parsed.description(), key));
                }
            }
            return Optional.empty();
        }
    }

    /** Last resort: any standalone six-digit token not starting with 0 in a text or integer value. */
    record ValueScan(NaicsCodeParser parser, NaicsCatalog catalog) implements SideChannelRule {

        @Override
        public String name() {
            return "value_scan";
        }

        @Override
        public Optional<SideChannelMatch> extract(Map<String, Object> extra) {
            for (Map.Entry<String, Object> entry : extra.entrySet()) {
                Object value = entry.getValue();
                if (!(value instanceof String || value instanceof Integer || value instanceof Long)) {
                    continue;
                }
                String valueText = String.valueOf(value);
                if (NaicsCatalog.isPlaceholder(valueText)) {
                    continue;
                }
                Matcher m = CODE_TOKEN.matcher(valueText);
                while (m.find()) {
                    String candidate = m.group(1);
                    if (candidate.charAt(0) == '0') {
                        continue;
                    }
                    NaicsParseResult parsed = parser.parse(valueText);
                    String description = candidate.equals(parsed.code())
                            ? parsed.description()
                            : catalog.describe(candidate).orElse(null);
                    return Optional.of(SideChannelMatch.found(candidate, description, "value_scan:" + entry.getKey()));
                }
            }
            return Optional.empty();
        }
    }
}
