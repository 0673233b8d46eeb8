package com.prospectenhancer.enhancement.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.prospectenhancer.enhancement.gateway.ModelGateway;
import com.prospectenhancer.enhancement.gateway.OllamaModelGateway;
import com.prospectenhancer.enhancement.setaside.StandardSetAside;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Enhancement pipeline wiring: model gateway with its local rate limiter, and the set-aside answer cache.
 */
@Configuration
@EnableConfigurationProperties({ ModelProperties.class, EnhancementProperties.class })
public class EnhancementConfig {

    public static final String MODEL_RATE_LIMITER = "modelRateLimiter";

    @Bean(name = MODEL_RATE_LIMITER)
    public RateLimiter modelRateLimiter(ModelProperties modelProperties) {
        int rps = Math.max(1, modelProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(modelProperties.getLimiterTimeout())
                .build();
        return RateLimiter.of(MODEL_RATE_LIMITER, config);
    }

    @Bean
    public ModelGateway modelGateway(WebClient.Builder webClientBuilder, ModelProperties modelProperties,
                                     RateLimiter modelRateLimiter) {
        return new OllamaModelGateway(webClientBuilder, modelProperties, modelRateLimiter);
    }

    /** Model answers per assembled set-aside input; the same phrasing recurs across thousands of records. */
    @Bean
    public Cache<String, StandardSetAside> setAsideClassificationCache(EnhancementProperties properties) {
        return Caffeine.newBuilder()
                .expireAfterWrite(properties.getSetAsideCacheTtl())
                .maximumSize(properties.getSetAsideCacheSize())
                .build();
    }
}
