package com.architecture.memory.specaudit.config;

import com.architecture.memory.specaudit.model.LlmConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Configuration for the external recommendation source.
 * Reads provider, key and model from application.yml properties.
 */
@Configuration
@Slf4j
public class RecommenderConfig {

    @Value("${spec-audit.recommender.provider:OPENAI}")
    private String provider;

    @Value("${spec-audit.recommender.base-url:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${spec-audit.recommender.api-key:}")
    private String apiKey;

    @Value("${spec-audit.recommender.model:gpt-4o}")
    private String model;

    @Value("${spec-audit.recommender.max-tokens:2000}")
    private int maxTokens;

    @Value("${spec-audit.recommender.temperature:0.2}")
    private double temperature;

    @Value("${spec-audit.recommender.timeout:60}")
    private int timeoutSeconds;

    @Bean
    public LlmConfiguration recommenderLlmConfiguration() {
        log.info("[Recommender Config] Provider: {}, model: {}, timeout: {}s", provider, model, timeoutSeconds);
        return LlmConfiguration.builder()
                .provider(provider)
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .model(model)
                .maxTokens(maxTokens)
                .temperature(temperature)
                .timeoutSeconds(timeoutSeconds)
                .build();
    }

    @Bean
    public RestTemplate recommenderRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(Math.min(10, timeoutSeconds)))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }
}
