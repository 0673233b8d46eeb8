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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rewrites vague procurement titles. A blank proposal or one identical to the original is "no enhancement".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TitleEnhancer {

    static final double DEFAULT_CONFIDENCE = 0.8;

    private final ModelInvoker modelInvoker;
    private final LlmAuditLog auditLog;

    public TitleEnhancement enhance(String originalTitle, String description, String agency, String prospectId) {
        String prompt = EnhancementPrompts.titleEnhancement(originalTitle, description, agency);
        ModelReply reply = modelInvoker.invoke(prompt);
        if (!reply.isReceived()) {
            auditLog.failure(prospectId, ModelInteractionType.TITLE_ENHANCEMENT, prompt, reply, Map.of(), reply.error());
            return TitleEnhancement.none();
        }
        Optional<JsonNode> json = ModelResponses.json(reply.raw()).filter(JsonNode::isObject);
        if (json.isEmpty()) {
            log.warn("Unreadable title answer for prospect {}", prospectId);
            auditLog.failure(prospectId, ModelInteractionType.TITLE_ENHANCEMENT, prompt, reply, Map.of(),
                    "Response is not a JSON object");
            return TitleEnhancement.none();
        }
        TitleEnhancement result = fromJson(json.get(), originalTitle);
        auditLog.success(prospectId, ModelInteractionType.TITLE_ENHANCEMENT, prompt, reply, toAuditMap(result));
        return result;
    }

    static TitleEnhancement fromJson(JsonNode node, String originalTitle) {
        String proposed = node.path("enhanced_title").asText("").strip();
        if (proposed.isEmpty() || proposed.equals(originalTitle)) {
            return TitleEnhancement.none();
        }
        JsonNode conf = node.get("confidence");
        double confidence = conf != null && conf.isNumber() ? conf.asDouble() : DEFAULT_CONFIDENCE;
        String reasoning = node.path("reasoning").asText("");
        return new TitleEnhancement(proposed, confidence, reasoning);
    }

    private static Map<String, Object> toAuditMap(TitleEnhancement t) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("enhanced_title", t.enhancedTitle());
        map.put("confidence", t.confidence());
        map.put("reasoning", t.reasoning());
        return map;
    }
}
