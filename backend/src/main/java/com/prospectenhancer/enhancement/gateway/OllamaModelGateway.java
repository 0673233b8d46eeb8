package com.prospectenhancer.enhancement.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prospectenhancer.enhancement.config.ModelProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Calls {@code POST {baseUrl}/api/generate} with streaming disabled and returns the {@code response} field.
 */
@Slf4j
public class OllamaModelGateway implements ModelGateway {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final ModelProperties properties;
    private final RateLimiter rateLimiter;

    public OllamaModelGateway(WebClient.Builder builder, ModelProperties properties, RateLimiter rateLimiter) {
        this.webClient = builder.build();
        this.properties = properties;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public String generate(String prompt) {
        if (!rateLimiter.acquirePermission()) {
            throw new ModelGatewayException(ModelGatewayException.RATE_LIMITED, "No model call permit within limiter timeout");
        }
        Map<String, Object> body = Map.of(
                "model", properties.getModelName(),
                "prompt", prompt,
                "stream", false,
                "options", Map.of("temperature", properties.getTemperature())
        );
        String envelope;
        try {
            envelope = webClient.post()
                    .uri(stripTrailingSlash(properties.getBaseUrl()) + "/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTimeout())
                    .block();
        } catch (WebClientResponseException e) {
            throw new ModelGatewayException(ModelGatewayException.TRANSPORT,
                    "Model backend returned HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new ModelGatewayException(ModelGatewayException.TIMEOUT,
                        "Model call exceeded " + properties.getTimeout(), e);
            }
            throw new ModelGatewayException(ModelGatewayException.TRANSPORT, "Model call failed: " + e.getMessage(), e);
        }
        return extractResponseText(envelope)
                .orElseThrow(() -> new ModelGatewayException(ModelGatewayException.BAD_RESPONSE,
                        "Model envelope has no response field"));
    }

    @Override
    public String modelName() {
        return properties.getModelName();
    }

    /**
     * Reads the {@code response} text from a generate envelope. Package-visible for tests.
     */
    static Optional<String> extractResponseText(String envelope) {
        if (envelope == null || envelope.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = MAPPER.readTree(envelope).path("response");
            return node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
        } catch (Exception e) {
            log.debug("Unreadable model envelope: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
