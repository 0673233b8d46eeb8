package com.prospectenhancer.enhancement.audit;

import com.prospectenhancer.domain.LlmOutput;
import com.prospectenhancer.domain.LlmOutputRepository;
import com.prospectenhancer.enhancement.gateway.ModelReply;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only record of every model interaction. A failing write is logged and never fails the enhancement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmAuditLog {

    private final LlmOutputRepository llmOutputRepository;

    public void success(String prospectId, ModelInteractionType type, String prompt, ModelReply reply,
                        Map<String, Object> parsedResult) {
        append(prospectId, type, prompt, reply, parsedResult, true, null);
    }

    public void failure(String prospectId, ModelInteractionType type, String prompt, ModelReply reply,
                        Map<String, Object> parsedResult, String errorMessage) {
        append(prospectId, type, prompt, reply, parsedResult, false, errorMessage);
    }

    public List<LlmOutput> findFor(String prospectId) {
        return llmOutputRepository.findByProspectIdOrderByTimestampDesc(prospectId);
    }

    public List<LlmOutput> findFor(String prospectId, ModelInteractionType type) {
        return llmOutputRepository.findByProspectIdAndEnhancementTypeOrderByTimestampDesc(prospectId, type.value());
    }

    private void append(String prospectId, ModelInteractionType type, String prompt, ModelReply reply,
                        Map<String, Object> parsedResult, boolean success, String errorMessage) {
        if (prospectId == null) {
            return;
        }
        LlmOutput output = new LlmOutput();
        output.setProspectId(prospectId);
        output.setEnhancementType(type.value());
        output.setPrompt(prompt);
        output.setResponse(reply.raw() != null ? reply.raw() : "");
        output.setParsedResult(parsedResult != null ? parsedResult : Map.of());
        output.setSuccess(success);
        output.setErrorMessage(errorMessage != null ? errorMessage : reply.error());
        output.setProcessingTimeMs(reply.elapsedMs());
        output.setTimestamp(Instant.now());
        try {
            llmOutputRepository.save(output);
        } catch (RuntimeException e) {
            log.error("Failed to record {} output for prospect {}: {}", type.value(), prospectId, e.getMessage(), e);
        }
    }
}
