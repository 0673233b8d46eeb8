package com.prospectenhancer.enhancement.gateway;

import com.prospectenhancer.enhancement.config.ModelProperties;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OllamaModelGatewayTest {

    private ModelProperties props;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        props = new ModelProperties();
        props.setBaseUrl("http://ollama.test:11434/");
        props.setModelName("qwen3:latest");
        rateLimiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(100)
                .timeoutDuration(Duration.ZERO)
                .build());
    }

    private static WebClient.Builder respondingWith(HttpStatus status, String body, AtomicReference<ClientRequest> seen) {
        return WebClient.builder()
                .exchangeFunction(req -> {
                    seen.set(req);
                    return Mono.just(ClientResponse.create(status)
                            .header("Content-Type", "application/json")
                            .body(body)
                            .build());
                });
    }

    @Test
    @DisplayName("generate posts to /api/generate and returns the response field")
    void generateReturnsResponse() {
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        OllamaModelGateway gateway = new OllamaModelGateway(
                respondingWith(HttpStatus.OK, "{\"model\":\"qwen3:latest\",\"response\":\"HUBZone\",\"done\":true}", seen),
                props, rateLimiter);

        assertThat(gateway.generate("classify this")).isEqualTo("HUBZone");
        assertThat(seen.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get().url().toString()).isEqualTo("http://ollama.test:11434/api/generate");
        assertThat(gateway.modelName()).isEqualTo("qwen3:latest");
    }

    @Test
    @DisplayName("HTTP error status is a transport failure")
    void httpErrorIsTransport() {
        OllamaModelGateway gateway = new OllamaModelGateway(
                respondingWith(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"model not loaded\"}", new AtomicReference<>()),
                props, rateLimiter);

        assertThatThrownBy(() -> gateway.generate("x"))
                .isInstanceOf(ModelGatewayException.class)
                .extracting("errorCode").isEqualTo(ModelGatewayException.TRANSPORT);
    }

    @Test
    @DisplayName("envelope without a response field is a bad response")
    void missingResponseField() {
        OllamaModelGateway gateway = new OllamaModelGateway(
                respondingWith(HttpStatus.OK, "{\"done\":true}", new AtomicReference<>()), props, rateLimiter);

        assertThatThrownBy(() -> gateway.generate("x"))
                .isInstanceOf(ModelGatewayException.class)
                .extracting("errorCode").isEqualTo(ModelGatewayException.BAD_RESPONSE);
    }

    @Test
    @DisplayName("no answer within the timeout is a timeout failure")
    void timeout() {
        props.setTimeout(Duration.ofMillis(50));
        WebClient.Builder silent = WebClient.builder().exchangeFunction(req -> Mono.never());
        OllamaModelGateway gateway = new OllamaModelGateway(silent, props, rateLimiter);

        assertThatThrownBy(() -> gateway.generate("x"))
                .isInstanceOf(ModelGatewayException.class)
                .extracting("errorCode").isEqualTo(ModelGatewayException.TIMEOUT);
    }

    @Test
    @DisplayName("exhausted rate limiter rejects the call without contacting the backend")
    void rateLimited() {
        RateLimiter single = RateLimiter.of("single", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofHours(1))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ZERO)
                .build());
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        OllamaModelGateway gateway = new OllamaModelGateway(
                respondingWith(HttpStatus.OK, "{\"response\":\"ok\"}", seen), props, single);

        assertThat(gateway.generate("first")).isEqualTo("ok");
        seen.set(null);

        assertThatThrownBy(() -> gateway.generate("second"))
                .isInstanceOf(ModelGatewayException.class)
                .extracting("errorCode").isEqualTo(ModelGatewayException.RATE_LIMITED);
        assertThat(seen.get()).isNull();
    }

    @Test
    @DisplayName("extractResponseText ignores non-text and malformed envelopes")
    void extractResponseText() {
        assertThat(OllamaModelGateway.extractResponseText("{\"response\":\"\"}")).contains("");
        assertThat(OllamaModelGateway.extractResponseText("{\"response\":42}")).isEmpty();
        assertThat(OllamaModelGateway.extractResponseText("not json")).isEmpty();
        assertThat(OllamaModelGateway.extractResponseText(null)).isEmpty();
    }
}
