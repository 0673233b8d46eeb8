package com.prospectenhancer.enhancement.setaside;

import com.github.benmanes.caffeine.cache.Cache;
import com.prospectenhancer.enhancement.audit.LlmAuditLog;
import com.prospectenhancer.enhancement.audit.ModelInteractionType;
import com.prospectenhancer.enhancement.gateway.ModelInvoker;
import com.prospectenhancer.enhancement.gateway.ModelReply;
import com.prospectenhancer.enhancement.gateway.ModelResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks the model to pick one category for set-aside text the deterministic rules could not place confidently.
 * Answers are cached per input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SetAsideModelClassifier {

    private static final String PROMPT = """
            You are a federal procurement specialist. Classify the given set-aside information into one of these EXACT categories:

            {categories}

            CLASSIFICATION RULES:
            - 8(a), HUBZone and Service-Disabled Veteran-Owned have separate "Sole Source" categories; use them only when sole source is explicit.
            - "Economically Disadvantaged Women-Owned" is for EDWOSB; other WOSB references are "Women-Owned".
            - "Unrestricted" and "Full and Open" are for open competition; "Sole Source" is for sole source awards not tied to a program.
            - "N/A" is for unclear, missing, TBD, other, unknown, or non-informative values.

            INPUT FORMATS:
            - Single field: "Small Business Set-Aside"
            - Multiple fields: "Set-aside: [value]; Small Business Program: [program]"
            - Program only: "Small Business Program: [program_name]"
            When multiple data sources are provided, prioritize the most specific information.

            Input: "{input}"

            Respond with ONLY the exact category name.""";

    private final ModelInvoker modelInvoker;
    private final LlmAuditLog auditLog;
    private final Cache<String, StandardSetAside> setAsideClassificationCache;

    public Optional<StandardSetAside> classify(String input, String prospectId) {
        String key = input.strip().toLowerCase();
        StandardSetAside cached = setAsideClassificationCache.getIfPresent(key);
        if (cached != null) {
            log.debug("Set-aside cache hit for '{}': {}", input, cached.code());
            return Optional.of(cached);
        }
        String prompt = prompt(input);
        ModelReply reply = modelInvoker.invoke(prompt);
        if (!reply.isReceived()) {
            auditLog.failure(prospectId, ModelInteractionType.SET_ASIDE_STANDARDIZATION, prompt, reply,
                    Map.of("original_input", input), reply.error());
            return Optional.empty();
        }
        String answer = ModelResponses.firstLine(reply.raw());
        Optional<StandardSetAside> match = match(answer);
        if (match.isEmpty()) {
            log.warn("Unrecognized set-aside classification '{}' for input '{}'", answer, input);
            auditLog.failure(prospectId, ModelInteractionType.SET_ASIDE_STANDARDIZATION, prompt, reply,
                    Map.of("llm_response", answer, "original_input", input), "Unrecognized response: '" + answer + "'");
            return Optional.empty();
        }
        StandardSetAside category = match.get();
        setAsideClassificationCache.put(key, category);
        Map<String, Object> parsed = new LinkedHashMap<>();
        parsed.put("standardized_code", category.code());
        parsed.put("standardized_label", category.label());
        parsed.put("original_input", input);
        parsed.put("llm_response", answer);
        auditLog.success(prospectId, ModelInteractionType.SET_ASIDE_STANDARDIZATION, prompt, reply, parsed);
        return match;
    }

    static String prompt(String input) {
        String categories = Arrays.stream(StandardSetAside.values())
                .map(c -> "- " + c.label())
                .collect(Collectors.joining("\n"));
        return PROMPT.replace("{categories}", categories).replace("{input}", input);
    }

    /**
     * Exact label or code first, then common variations, most specific first.
     */
    static Optional<StandardSetAside> match(String answer) {
        if (answer == null) {
            return Optional.empty();
        }
        String text = answer.strip().replaceAll("^[\"'*\\-\\s]+|[\"'*.\\s]+$", "");
        if (text.isEmpty()) {
            return Optional.empty();
        }
        Optional<StandardSetAside> exact = StandardSetAside.fromLabelOrCode(text);
        if (exact.isPresent()) {
            return exact;
        }
        String t = text.toLowerCase();
        boolean soleSource = t.contains("sole source") || t.contains("sole-source");
        if (t.contains("8(a)") || t.contains("eight a") || t.equals("8a")) {
            return Optional.of(soleSource ? StandardSetAside.EIGHT_A_SOLE_SOURCE : StandardSetAside.EIGHT_A_COMPETITIVE);
        }
        if (t.contains("hubzone") || t.contains("hub zone")) {
            return Optional.of(soleSource ? StandardSetAside.HUBZONE_SOLE_SOURCE : StandardSetAside.HUBZONE);
        }
        if (t.contains("service-disabled") || t.contains("service disabled") || t.contains("sdvosb")) {
            return Optional.of(soleSource ? StandardSetAside.SDVOSB_SOLE_SOURCE : StandardSetAside.SDVOSB);
        }
        if (t.contains("economically disadvantaged") || t.contains("edwosb")) {
            return Optional.of(StandardSetAside.EDWOSB);
        }
        if (t.contains("women") && t.contains("owned")) {
            return Optional.of(StandardSetAside.WOMEN_OWNED);
        }
        if (t.contains("veteran") && t.contains("owned")) {
            return Optional.of(StandardSetAside.VETERAN_OWNED);
        }
        if (t.contains("small disadvantaged")) {
            return Optional.of(StandardSetAside.SMALL_DISADVANTAGED);
        }
        if (t.contains("other than small")) {
            return Optional.of(StandardSetAside.OTHER_THAN_SMALL);
        }
        if (t.contains("small business total") || t.contains("total small business")) {
            return Optional.of(StandardSetAside.SMALL_BUSINESS_TOTAL);
        }
        if (t.contains("small business") || t.equals("small")) {
            return Optional.of(StandardSetAside.SMALL_BUSINESS);
        }
        if (t.contains("full and open")) {
            return Optional.of(StandardSetAside.FULL_AND_OPEN);
        }
        if (t.equals("unrestricted")) {
            return Optional.of(StandardSetAside.UNRESTRICTED);
        }
        if (soleSource) {
            return Optional.of(StandardSetAside.SOLE_SOURCE);
        }
        if (t.equals("n/a") || t.equals("na") || t.equals("not available") || t.equals("none") || t.equals("unknown")) {
            return Optional.of(StandardSetAside.NOT_AVAILABLE);
        }
        return Optional.empty();
    }
}
