package com.prospectenhancer.enhancement.setaside;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic set-aside classification: cleaning, then exact phrase lookup (0.95), then ordered
 * patterns (0.80), else Not-Available (0.60, or 1.0 for empty input).
 * <p>
 * Labelled input from {@link SetAsideInputs} is classified part by part; the most specific category
 * other than Not-Available wins.
 */
@Component
public class SetAsideStandardizer {

    public static final double EXACT_CONFIDENCE = 0.95;
    public static final double PATTERN_CONFIDENCE = 0.80;
    public static final double NO_MATCH_CONFIDENCE = 0.60;
    public static final double EMPTY_CONFIDENCE = 1.0;

    private static final Pattern NUMERIC_DATE = Pattern.compile("\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b");
    private static final Pattern ISO_DATE = Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b");
    private static final Pattern WRITTEN_DATE = Pattern.compile(
            "\\b(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{4}\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FISCAL_YEAR = Pattern.compile("\\bFY\\s?\\d{2,4}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNTRY = Pattern.compile(
            "\\b(?:united states(?: of america)?|usa)\\b|\\bu\\.s\\.(?:a\\.)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_STATE = Pattern.compile(
            "[\\s,;(/-]+(?:AL|AK|AZ|AR|CA|CO|CT|DE|FL|GA|HI|ID|IL|IN|IA|KS|KY|LA|ME|MD|MA|MI|MN|MS|MO|MT|NE|NV|NH|NJ"
                    + "|NM|NY|NC|ND|OH|OK|OR|PA|RI|SC|SD|TN|TX|UT|VT|VA|WA|WV|WI|WY|DC|PR)\\)?\\s*$");
    private static final Pattern SEPARATORS = Pattern.compile("[;:|_*]+|\\s+[-–—/]+\\s+");
    private static final Pattern EMPTY_PARENS = Pattern.compile("\\(\\s*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LABELLED_PART = Pattern.compile(
            "(?:^|;)\\s*(?:" + Pattern.quote(SetAsideInputs.SET_ASIDE_LABEL.strip()) + "|"
                    + Pattern.quote(SetAsideInputs.PROGRAM_LABEL.strip()) + ")\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Map<String, StandardSetAside> EXACT = buildExact();

    /** Most specific first. */
    private static final List<Rule> RULES = List.of(
            rule("\\b8\\s*\\(?a\\)?.*sole[\\s-]*source|sole[\\s-]*source.*\\b8\\s*\\(?a\\)?", StandardSetAside.EIGHT_A_SOLE_SOURCE),
            rule("\\b8\\s*\\(a\\)|\\b8a\\b|\\beight\\s*\\(?a\\)?", StandardSetAside.EIGHT_A_COMPETITIVE),
            rule("hub\\s*zone.*sole[\\s-]*source|sole[\\s-]*source.*hub\\s*zone", StandardSetAside.HUBZONE_SOLE_SOURCE),
            rule("hub\\s*zone", StandardSetAside.HUBZONE),
            rule("(?:service[\\s-]*disabled|\\bsdvo).*sole[\\s-]*source|sole[\\s-]*source.*(?:service[\\s-]*disabled|\\bsdvo)",
                    StandardSetAside.SDVOSB_SOLE_SOURCE),
            rule("service[\\s-]*disabled|\\bsdvo", StandardSetAside.SDVOSB),
            rule("\\bedwosb\\b|economically[\\s-]*disadvantaged[\\s-]*wom[ae]n", StandardSetAside.EDWOSB),
            rule("\\bwosb\\b|wom[ae]n[\\s-]*owned", StandardSetAside.WOMEN_OWNED),
            rule("\\bvosb\\b|veteran", StandardSetAside.VETERAN_OWNED),
            rule("small[\\s-]*disadvantaged|\\bsdb\\b", StandardSetAside.SMALL_DISADVANTAGED),
            rule("total[\\s-]*small[\\s-]*business|small[\\s-]*business[\\s-]*(?:set[\\s-]*aside[\\s-]*)?total",
                    StandardSetAside.SMALL_BUSINESS_TOTAL),
            rule("other[\\s-]*than[\\s-]*small|large[\\s-]*business", StandardSetAside.OTHER_THAN_SMALL),
            rule("small[\\s-]*business|\\bsb\\b|\\bsbsa\\b", StandardSetAside.SMALL_BUSINESS),
            rule("full[\\s-]*(?:and|&)[\\s-]*open|open[\\s-]*competition", StandardSetAside.FULL_AND_OPEN),
            rule("unrestricted|\\bno[\\s-]*set[\\s-]*aside", StandardSetAside.UNRESTRICTED),
            rule("sole[\\s-]*source|single[\\s-]*source", StandardSetAside.SOLE_SOURCE),
            rule("\\btbd\\b|to\\s+be\\s+determined|not\\s+available|not\\s+applicable|\\bunknown\\b", StandardSetAside.NOT_AVAILABLE)
    );

    private static final Map<StandardSetAside, Integer> SPECIFICITY = buildSpecificity();

    public SetAsideResult standardize(String raw) {
        String input = raw == null ? "" : raw.strip();
        if (!LABELLED_PART.matcher(input).lookingAt()) {
            return standardizeText(input, input);
        }
        List<SetAsideResult> parts = new ArrayList<>();
        for (String part : LABELLED_PART.split(input)) {
            if (!part.isBlank()) {
                parts.add(standardizeText(part, input));
            }
        }
        if (parts.isEmpty()) {
            return standardizeText("", input);
        }
        return parts.stream()
                .filter(r -> r.category() != StandardSetAside.NOT_AVAILABLE)
                .min(Comparator.comparingInt(r -> SPECIFICITY.get(r.category())))
                .orElse(parts.get(0));
    }

    private SetAsideResult standardizeText(String text, String input) {
        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return new SetAsideResult(StandardSetAside.NOT_AVAILABLE, EMPTY_CONFIDENCE, SetAsideResult.Method.DEFAULT, input);
        }
        String key = cleaned.toLowerCase();
        StandardSetAside exact = EXACT.get(key);
        if (exact != null) {
            return new SetAsideResult(exact, EXACT_CONFIDENCE, SetAsideResult.Method.EXACT, input);
        }
        for (Rule r : RULES) {
            if (r.pattern().matcher(key).find()) {
                return new SetAsideResult(r.category(), PATTERN_CONFIDENCE, SetAsideResult.Method.PATTERN, input);
            }
        }
        return new SetAsideResult(StandardSetAside.NOT_AVAILABLE, NO_MATCH_CONFIDENCE, SetAsideResult.Method.DEFAULT, input);
    }

    /**
     * Removes dates, a trailing state code, country names and separator punctuation; collapses whitespace.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String s = TRAILING_STATE.matcher(raw.strip()).replaceAll("");
        s = NUMERIC_DATE.matcher(s).replaceAll(" ");
        s = ISO_DATE.matcher(s).replaceAll(" ");
        s = WRITTEN_DATE.matcher(s).replaceAll(" ");
        s = FISCAL_YEAR.matcher(s).replaceAll(" ");
        s = COUNTRY.matcher(s).replaceAll(" ");
        s = SEPARATORS.matcher(s).replaceAll(" ");
        s = EMPTY_PARENS.matcher(s).replaceAll(" ");
        s = WHITESPACE.matcher(s).replaceAll(" ").strip();
        return stripEdgePunctuation(s);
    }

    private static String stripEdgePunctuation(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && "-,./ ".indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && "-,./ ".indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(start, end);
    }

    private static Rule rule(String regex, StandardSetAside category) {
        return new Rule(Pattern.compile(regex), category);
    }

    private static Map<StandardSetAside, Integer> buildSpecificity() {
        Map<StandardSetAside, Integer> m = new EnumMap<>(StandardSetAside.class);
        for (StandardSetAside category : StandardSetAside.values()) {
            m.put(category, RULES.size());
        }
        for (int i = RULES.size() - 1; i >= 0; i--) {
            m.put(RULES.get(i).category(), i);
        }
        return m;
    }

    private static Map<String, StandardSetAside> buildExact() {
        Map<String, StandardSetAside> m = new HashMap<>();
        put(m, StandardSetAside.SMALL_BUSINESS, "small business", "small business set-aside", "small business set aside",
                "sb", "sbsa", "small business set-aside partial", "partial small business set-aside");
        put(m, StandardSetAside.SMALL_BUSINESS_TOTAL, "small business total", "total small business",
                "total small business set-aside", "total small business set aside", "small business set-aside total");
        put(m, StandardSetAside.EIGHT_A_COMPETITIVE, "8(a)", "8a", "8(a) competitive", "8(a) set-aside",
                "8(a) set aside", "8(a) competitive set-aside", "competitive 8(a)");
        put(m, StandardSetAside.EIGHT_A_SOLE_SOURCE, "8(a) sole source", "8a sole source", "8(a) sole-source",
                "8(a) direct award");
        put(m, StandardSetAside.HUBZONE, "hubzone", "hub zone", "hubzone set-aside", "hubzone set aside",
                "hubzone small business");
        put(m, StandardSetAside.HUBZONE_SOLE_SOURCE, "hubzone sole source", "hubzone sole-source");
        put(m, StandardSetAside.WOMEN_OWNED, "wosb", "women-owned", "women owned", "women-owned small business",
                "women owned small business", "wosb set-aside", "wosb set aside");
        put(m, StandardSetAside.EDWOSB, "edwosb", "economically disadvantaged women-owned small business",
                "economically disadvantaged women owned small business", "economically disadvantaged wosb");
        put(m, StandardSetAside.SDVOSB, "sdvosb", "sdvosbc", "service-disabled veteran-owned small business",
                "service disabled veteran owned small business", "sdvosb set-aside", "sdvosb set aside");
        put(m, StandardSetAside.SDVOSB_SOLE_SOURCE, "sdvosb sole source", "sdvosb sole-source");
        put(m, StandardSetAside.VETERAN_OWNED, "vosb", "veteran-owned", "veteran owned", "veteran-owned small business",
                "veteran owned small business");
        put(m, StandardSetAside.SMALL_DISADVANTAGED, "sdb", "small disadvantaged business", "small disadvantaged");
        put(m, StandardSetAside.FULL_AND_OPEN, "full and open", "full and open competition", "full & open",
                "open competition");
        put(m, StandardSetAside.UNRESTRICTED, "unrestricted", "no set-aside", "no set aside", "no set aside used",
                "no set-aside used");
        put(m, StandardSetAside.SOLE_SOURCE, "sole source", "sole-source", "single source");
        put(m, StandardSetAside.OTHER_THAN_SMALL, "other than small", "other than small business", "large business");
        put(m, StandardSetAside.NOT_AVAILABLE, "n/a", "na", "tbd", "to be determined", "unknown", "none",
                "not available", "currently not available", "not applicable", "other");
        return Map.copyOf(m);
    }

    private static void put(Map<String, StandardSetAside> m, StandardSetAside category, String... phrases) {
        for (String p : phrases) {
            m.put(p, category);
        }
    }

    private record Rule(Pattern pattern, StandardSetAside category) {
    }
}
