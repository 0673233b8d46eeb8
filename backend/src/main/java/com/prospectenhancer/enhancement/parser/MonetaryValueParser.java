package com.prospectenhancer.enhancement.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.prospectenhancer.enhancement.audit.LlmAuditLog;
import com.prospectenhancer.enhancement.audit.ModelInteractionType;
import com.prospectenhancer.enhancement.gateway.ModelInvoker;
import com.prospectenhancer.enhancement.gateway.ModelReply;
import com.prospectenhancer.enhancement.gateway.ModelResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the model to read free-text contract values and enforces the single-or-range contract locally.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MonetaryValueParser {

    static final double DEFAULT_CONFIDENCE = 1.0;

    private final ModelInvoker modelInvoker;
    private final LlmAuditLog auditLog;

    public MonetaryValue parse(String valueText, String prospectId) {
        if (valueText == null || valueText.isBlank()) {
            return MonetaryValue.unparsed();
        }
        String prompt = EnhancementPrompts.valueParsing(valueText);
        ModelReply reply = modelInvoker.invoke(prompt);
        if (!reply.isReceived()) {
            auditLog.failure(prospectId, ModelInteractionType.VALUE_PARSING, prompt, reply, Map.of(), reply.error());
            return MonetaryValue.unparsed();
        }
        Optional<MonetaryValue> parsed = ModelResponses.json(reply.raw()).flatMap(MonetaryValueParser::fromJson);
        if (parsed.isEmpty()) {
            log.warn("Unreadable value parsing answer for prospect {}", prospectId);
            auditLog.failure(prospectId, ModelInteractionType.VALUE_PARSING, prompt, reply, Map.of(),
                    "Response is not a JSON object with numeric fields");
            return MonetaryValue.unparsed();
        }
        MonetaryValue value = parsed.get();
        auditLog.success(prospectId, ModelInteractionType.VALUE_PARSING, prompt, reply, toAuditMap(value));
        return value;
    }

    /**
     * Reads {single, min, max, confidence} from a model answer. Empty when the shape is wrong or a field
     * is present but not numeric.
     */
    static Optional<MonetaryValue> fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        try {
            BigDecimal single = number(node.get("single"));
            BigDecimal min = number(node.get("min"));
            BigDecimal max = number(node.get("max"));
            JsonNode conf = node.get("confidence");
            double confidence = conf != null && conf.isNumber() ? conf.asDouble() : DEFAULT_CONFIDENCE;
            return Optional.of(MonetaryValue.normalize(single, min, max, confidence));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigDecimal number(JsonNode field) {
        if (field == null || field.isNull()) {
            return null;
        }
        if (field.isNumber()) {
            return field.decimalValue();
        }
        if (field.isTextual()) {
            String text = field.asText().replace(",", "").replace("$", "").strip();
            return text.isEmpty() ? null : new BigDecimal(text);
        }
        throw new NumberFormatException("Not a number: " + field);
    }

    private static Map<String, Object> toAuditMap(MonetaryValue value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("single", value.single());
        map.put("min", value.min());
        map.put("max", value.max());
        map.put("confidence", value.confidence());
        return map;
    }
}
