package com.prospectenhancer.enhancement.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Language-model backend (Ollama-compatible generate endpoint).
 */
@ConfigurationProperties(prefix = "prospect-enhancer.model")
@NoArgsConstructor
@Getter
@Setter
public class ModelProperties {

    /** Base URL of the model server, without trailing path. */
    private String baseUrl = "http://localhost:11434";

    /** Model tag sent with every request and recorded on enhanced prospects. */
    private String modelName = "qwen3:latest";

    /** Hard timeout for a single generate call. Large models on CPU routinely take minutes. */
    private Duration timeout = Duration.ofSeconds(240);

    private double temperature = 0.1;

    /** Local limiter on outgoing calls. */
    private int maxRequestsPerSecond = 2;

    /** How long a caller may wait for a limiter permit before the call is treated as failed. */
    private Duration limiterTimeout = Duration.ofSeconds(30);
}
