package com.prospectenhancer.enhancement.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns raw model text into something parseable: reasoning blocks and Markdown fences removed,
 * embedded JSON located.
 */
public final class ModelResponses {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern THINK = Pattern.compile("<think(?:ing)?>.*?</think(?:ing)?>",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCE = Pattern.compile("```(?:json)?", Pattern.CASE_INSENSITIVE);

    private ModelResponses() {
    }

    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = THINK.matcher(raw).replaceAll("");
        return FENCE.matcher(text).replaceAll("").strip();
    }

    /** First non-blank line of the cleaned text, or empty string. */
    public static String firstLine(String raw) {
        return Arrays.stream(clean(raw).split("\\R"))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .findFirst()
                .orElse("");
    }

    /**
     * Parses the cleaned text as JSON, falling back to the outermost object or array embedded in prose.
     */
    public static Optional<JsonNode> json(String raw) {
        String text = clean(raw);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Optional<JsonNode> direct = tryParse(text);
        if (direct.isPresent()) {
            return direct;
        }
        return embedded(text, '{', '}').or(() -> embedded(text, '[', ']'));
    }

    private static Optional<JsonNode> embedded(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return tryParse(text.substring(start, end + 1));
    }

    private static Optional<JsonNode> tryParse(String text) {
        try {
            JsonNode node = MAPPER.readTree(text);
            return node == null || node.isMissingNode() ? Optional.empty() : Optional.of(node);
        } catch (Exception e) {
            return Optional.empty();
        }
    }
}
