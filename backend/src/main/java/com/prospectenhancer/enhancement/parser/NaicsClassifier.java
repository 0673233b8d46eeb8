package com.prospectenhancer.enhancement.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.prospectenhancer.common.NaicsCatalog;
import com.prospectenhancer.domain.Prospect;
import com.prospectenhancer.enhancement.audit.LlmAuditLog;
import com.prospectenhancer.enhancement.audit.ModelInteractionType;
import com.prospectenhancer.enhancement.gateway.ModelInvoker;
import com.prospectenhancer.enhancement.gateway.ModelReply;
import com.prospectenhancer.enhancement.gateway.ModelResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the model for up to three NAICS codes. Only codes the catalog knows are kept, and descriptions
 * always come from the catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NaicsClassifier {

    static final int MAX_CANDIDATES = 3;
    static final double DEFAULT_CONFIDENCE = 0.8;

    private final ModelInvoker modelInvoker;
    private final LlmAuditLog auditLog;
    private final NaicsCatalog naicsCatalog;

    public NaicsClassification classify(Prospect prospect) {
        String prompt = EnhancementPrompts.naicsClassification(prospect.getTitle(), prospect.getDescription(),
                prospect.getAgency(), prospect.getContractType(), prospect.getSetAside(),
                prospect.getEstimatedValueText());
        ModelReply reply = modelInvoker.invoke(prompt);
        if (!reply.isReceived()) {
            auditLog.failure(prospect.getId(), ModelInteractionType.NAICS_CLASSIFICATION, prompt, reply, Map.of(),
                    reply.error());
            return NaicsClassification.none();
        }
        Optional<JsonNode> json = ModelResponses.json(reply.raw()).filter(JsonNode::isArray);
        if (json.isEmpty()) {
            log.warn("Unreadable NAICS answer for prospect {}", prospect.getId());
            auditLog.failure(prospect.getId(), ModelInteractionType.NAICS_CLASSIFICATION, prompt, reply, Map.of(),
                    "Response is not a JSON array of codes");
            return NaicsClassification.none();
        }
        NaicsClassification result = NaicsClassification.of(candidates(json.get()));
        auditLog.success(prospect.getId(), ModelInteractionType.NAICS_CLASSIFICATION, prompt, reply, toAuditMap(result));
        return result;
    }

    /**
     * Sorts by confidence, keeps the top three, then drops codes that fail catalog validation.
     */
    List<NaicsCandidate> candidates(JsonNode array) {
        List<JsonNode> entries = new ArrayList<>();
        array.forEach(entries::add);
        entries.sort(Comparator.comparingDouble(NaicsClassifier::confidenceOf).reversed());
        List<NaicsCandidate> result = new ArrayList<>();
        for (JsonNode entry : entries.subList(0, Math.min(MAX_CANDIDATES, entries.size()))) {
            String code = entry.path("code").asText("").strip();
            if (!naicsCatalog.isValid(code)) {
                continue;
            }
            JsonNode conf = entry.get("confidence");
            double confidence = conf != null && conf.isNumber() ? conf.asDouble() : DEFAULT_CONFIDENCE;
            result.add(new NaicsCandidate(code, naicsCatalog.describe(code).orElse(null), confidence));
        }
        return result;
    }

    private static double confidenceOf(JsonNode entry) {
        JsonNode conf = entry.get("confidence");
        return conf != null && conf.isNumber() ? conf.asDouble() : 0.0;
    }

    private static Map<String, Object> toAuditMap(NaicsClassification c) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("code", c.code());
        map.put("description", c.description());
        map.put("confidence", c.confidence());
        map.put("all_codes", c.candidates().stream()
                .map(x -> Map.<String, Object>of("code", x.code(), "confidence", x.confidence()))
                .toList());
        return map;
    }
}
