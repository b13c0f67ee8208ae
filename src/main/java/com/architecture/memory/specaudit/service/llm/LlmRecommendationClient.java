package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.exception.RecommendationFormatException;
import com.architecture.memory.specaudit.model.LlmConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Locale;

/**
 * Recommendation source backed by a chat-completion API (OpenAI, OpenRouter, Anthropic).
 */
@Service
@Slf4j
public class LlmRecommendationClient implements RecommendationPort {

    private final LlmConfiguration config;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RecommendationResponseParser parser;

    public LlmRecommendationClient(@Qualifier("recommenderLlmConfiguration") LlmConfiguration config,
                                   @Qualifier("recommenderRestTemplate") RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   RecommendationResponseParser parser) {
        this.config = config;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    @Override
    public List<RecommendationRecord> submit(EvaluationRequest request) {
        if (!config.isConfigured()) {
            throw new EvaluatorUnavailableException("Recommendation source is not configured (missing api key or base url)");
        }
        log.info("Requesting recommendations for {} from {} - model: {}",
                request.describe(), config.getProvider(), config.getModel());

        String answer = exchange(request);
        List<RecommendationRecord> records = parser.parse(answer);
        log.debug("Received {} recommendations for {}", records.size(), request.describe());
        return records;
    }

    String exchange(EvaluationRequest request) {
        Dialect dialect = Dialect.of(config.getProvider());
        try {
            JsonNode response = post(config.getBaseUrl() + dialect.path, requestBody(dialect, request), headers(dialect));
            return response.at(dialect.answerPointer).asText();
        } catch (ResourceAccessException e) {
            throw new EvaluatorUnavailableException("Recommendation source unreachable: " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new EvaluatorUnavailableException("Recommendation source failed with " + e.getStatusCode(), e);
        } catch (HttpClientErrorException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403 || status == 429) {
                throw new EvaluatorUnavailableException("Recommendation source refused the request with " + status, e);
            }
            throw new RecommendationFormatException("Recommendation request rejected with " + status, e);
        } catch (JsonProcessingException e) {
            throw new RecommendationFormatException("Malformed response from recommendation source", e);
        }
    }

    // ========================= PROVIDERS =========================

    /**
     * Wire differences between the two chat APIs. OpenRouter speaks the OpenAI dialect.
     */
    enum Dialect {
        CHAT_COMPLETIONS("/chat/completions", false, null, "/choices/0/message/content"),
        MESSAGES("/messages", true, 4096, "/content/0/text");

        final String path;
        final boolean topLevelSystemPrompt;
        final Integer defaultMaxTokens;
        final String answerPointer;

        Dialect(String path, boolean topLevelSystemPrompt, Integer defaultMaxTokens, String answerPointer) {
            this.path = path;
            this.topLevelSystemPrompt = topLevelSystemPrompt;
            this.defaultMaxTokens = defaultMaxTokens;
            this.answerPointer = answerPointer;
        }

        static Dialect of(String provider) {
            return switch (provider == null ? "" : provider.toUpperCase(Locale.ROOT)) {
                case "OPENAI", "OPENROUTER" -> CHAT_COMPLETIONS;
                case "ANTHROPIC", "CLAUDE" -> MESSAGES;
                default -> throw new EvaluatorUnavailableException("Unsupported provider: " + provider);
            };
        }
    }

    /**
     * One request per evaluation: the fixed instructions plus the rendered context of the
     * node types, relationships and predicates under evaluation.
     */
    ObjectNode requestBody(Dialect dialect, EvaluationRequest request) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.getModel());
        Integer maxTokens = config.getMaxTokens() != null ? config.getMaxTokens() : dialect.defaultMaxTokens;
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }
        if (config.getTemperature() != null) {
            body.put("temperature", config.getTemperature());
        }
        if (dialect.topLevelSystemPrompt) {
            body.put("system", PromptTemplates.SYSTEM_PROMPT);
        }

        ArrayNode messages = body.putArray("messages");
        if (!dialect.topLevelSystemPrompt) {
            messages.addObject().put("role", "system").put("content", PromptTemplates.SYSTEM_PROMPT);
        }
        messages.addObject().put("role", "user").put("content", PromptTemplates.userPrompt(request));
        return body;
    }

    private HttpHeaders headers(Dialect dialect) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (dialect == Dialect.MESSAGES) {
            headers.set("x-api-key", config.getApiKey());
            headers.set("anthropic-version", "2023-06-01");
        } else {
            headers.setBearerAuth(config.getApiKey());
        }
        return headers;
    }

    private JsonNode post(String endpoint, ObjectNode body, HttpHeaders headers) throws JsonProcessingException {
        HttpEntity<String> request = new HttpEntity<>(objectMapper.writeValueAsString(body), headers);
        ResponseEntity<String> response = restTemplate.exchange(endpoint, HttpMethod.POST, request, String.class);
        if (response.getBody() == null) {
            throw new RecommendationFormatException("Empty response body from " + endpoint);
        }
        return objectMapper.readTree(response.getBody());
    }
}
