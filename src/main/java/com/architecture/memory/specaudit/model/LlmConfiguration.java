package com.architecture.memory.specaudit.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Connection settings for the external recommendation source (OpenAI, Anthropic, OpenRouter).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmConfiguration {

    /**
     * LLM provider (e.g., "OPENAI", "ANTHROPIC", "OPENROUTER")
     */
    private String provider;

    /**
     * Base URL for the API (e.g., "https://api.openai.com/v1", "https://api.anthropic.com/v1")
     */
    private String baseUrl;

    private String apiKey;

    /**
     * Model to use (e.g., "gpt-4o", "claude-3-5-sonnet-20241022")
     */
    private String model;

    private Integer maxTokens;

    /**
     * Temperature for generation (0.0 - 1.0)
     */
    private Double temperature;

    /**
     * Upper bound for one recommendation call, after which the source counts as unavailable
     */
    @Builder.Default
    private int timeoutSeconds = 60;

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && baseUrl != null && !baseUrl.isBlank();
    }
}
