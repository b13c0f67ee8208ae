package com.architecture.memory.specaudit.service.llm;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.recommendation.EvaluationRequest;
import com.architecture.memory.specaudit.dto.recommendation.RecommendationRecord;
import com.architecture.memory.specaudit.exception.EvaluatorUnavailableException;
import com.architecture.memory.specaudit.exception.RecommendationFormatException;
import com.architecture.memory.specaudit.model.LlmConfiguration;
import com.architecture.memory.specaudit.model.NodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmRecommendationClientTest {

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    private final EvaluationRequest request = EvaluationRequest.builder()
            .kind(EvaluationRequest.Kind.NODE_TYPE)
            .nodeTypes(List.of(NodeType.builder().specNodeId("business.event").layerId("business").type("event")
                    .description("A state change").build()))
            .availablePredicates(List.of("triggers"))
            .build();

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private LlmRecommendationClient client(String provider, String apiKey) {
        LlmConfiguration config = LlmConfiguration.builder()
                .provider(provider)
                .baseUrl("https://llm.example.org/v1")
                .apiKey(apiKey)
                .model("test-model")
                .maxTokens(500)
                .temperature(0.2)
                .build();
        return new LlmRecommendationClient(config, restTemplate, SpecFixture.MAPPER,
                new RecommendationResponseParser(SpecFixture.MAPPER));
    }

    @Test
    void postsChatCompletion_andParsesAnswer_forOpenAiProvider() {
        server.expect(requestTo("https://llm.example.org/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer secret"))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":"
                        + "\"[{\\\"source\\\":\\\"business.event\\\",\\\"destination\\\":\\\"business.process\\\","
                        + "\\\"predicate\\\":\\\"triggers\\\"}]\"}}]}", MediaType.APPLICATION_JSON));

        List<RecommendationRecord> records = client("OPENAI", "secret").submit(request);

        assertThat(records).extracting(RecommendationRecord::key)
                .containsExactly("business.event|triggers|business.process");
        server.verify();
    }

    @Test
    void sendsApiKeyHeader_forAnthropicProvider() {
        server.expect(requestTo("https://llm.example.org/v1/messages"))
                .andExpect(header("x-api-key", "secret"))
                .andExpect(jsonPath("$.system").exists())
                .andRespond(withSuccess("{\"content\":[{\"text\":\"[]\"}]}", MediaType.APPLICATION_JSON));

        assertThat(client("ANTHROPIC", "secret").submit(request)).isEmpty();
        server.verify();
    }

    @Test
    void reportsUnavailable_whenApiKeyIsMissing() {
        assertThatThrownBy(() -> client("OPENAI", null).submit(request))
                .isInstanceOf(EvaluatorUnavailableException.class);
    }

    @Test
    void reportsUnavailable_onServerErrorAndRateLimit() {
        server.expect(requestTo("https://llm.example.org/v1/chat/completions")).andRespond(withServerError());
        assertThatThrownBy(() -> client("OPENAI", "secret").submit(request))
                .isInstanceOf(EvaluatorUnavailableException.class);

        server.reset();
        server.expect(requestTo("https://llm.example.org/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        assertThatThrownBy(() -> client("OPENAI", "secret").submit(request))
                .isInstanceOf(EvaluatorUnavailableException.class);
    }

    @Test
    void reportsFormatError_onBadRequest() {
        server.expect(requestTo("https://llm.example.org/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST));

        assertThatThrownBy(() -> client("OPENAI", "secret").submit(request))
                .isInstanceOf(RecommendationFormatException.class);
    }

    @Test
    void buildsBothDialectsFromTheSameEvaluationRequest() {
        LlmConfiguration config = LlmConfiguration.builder()
                .provider("CLAUDE").baseUrl("https://llm.example.org/v1").apiKey("secret").model("test-model").build();
        LlmRecommendationClient unbounded = new LlmRecommendationClient(config, restTemplate, SpecFixture.MAPPER,
                new RecommendationResponseParser(SpecFixture.MAPPER));

        ObjectNode messagesBody = unbounded.requestBody(LlmRecommendationClient.Dialect.MESSAGES, request);
        ObjectNode chatBody = unbounded.requestBody(LlmRecommendationClient.Dialect.CHAT_COMPLETIONS, request);

        assertThat(messagesBody.path("max_tokens").asInt()).isEqualTo(4096);
        assertThat(messagesBody.path("system").asText()).isEqualTo(PromptTemplates.SYSTEM_PROMPT);
        assertThat(messagesBody.path("messages")).hasSize(1);
        assertThat(chatBody.has("max_tokens")).isFalse();
        assertThat(chatBody.path("messages")).hasSize(2);
        assertThat(chatBody.path("messages").path(0).path("content").asText()).isEqualTo(PromptTemplates.SYSTEM_PROMPT);
        assertThat(chatBody.path("messages").path(1).path("content").asText())
                .isEqualTo(messagesBody.path("messages").path(0).path("content").asText())
                .contains("business.event");
    }

    @Test
    void reportsUnavailable_forUnsupportedProvider() {
        assertThatThrownBy(() -> client("COHERE", "secret").submit(request))
                .isInstanceOf(EvaluatorUnavailableException.class)
                .hasMessage("Unsupported provider: COHERE");
    }
}
