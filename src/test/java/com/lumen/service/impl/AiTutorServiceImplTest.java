package com.lumen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.config.LumenProperties.AiSettings;
import com.lumen.config.LumenProperties.RetrySettings;
import com.lumen.exception.GenerationFailureException;
import com.lumen.model.Turn;
import com.lumen.model.TurnRole;
import com.lumen.retry.RetryExecutor;
import com.lumen.transport.OkHttpTransport;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AiTutorServiceImpl}.
 * <p>
 * Uses {@link MockWebServer} to simulate the external AI API, ensuring full coverage
 * of HTTP networking, payload construction, retries and response parsing logic.
 * </p>
 */
class AiTutorServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final List<Turn> CONVERSATION = List.of(
            new Turn("s-1", 0, TurnRole.SYSTEM, "You are a tutor.", NOW),
            new Turn("s-1", 1, TurnRole.ASSISTANT, "Olá!", NOW),
            new Turn("s-1", 2, TurnRole.USER, "What is a variable?", NOW));

    private MockWebServer mockWebServer;
    private Scheduler scheduler;
    private AiTutorServiceImpl aiTutorService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        // Spin up a local mock server
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        scheduler = Schedulers.newSingle("test-retry");

        var settings = new AiSettings("accounts/fireworks/models/qwen3-coder-30b-a3b-instruct", 0.7, 2048,
                Duration.ofSeconds(5), new RetrySettings(2, Duration.ofMillis(1), Duration.ofMillis(10), 2.0));

        aiTutorService = new AiTutorServiceImpl(OkHttpTransport.withTimeout(Duration.ofSeconds(5)),
                new RetryExecutor(scheduler), objectMapper, settings,
                mockWebServer.url("/v1/chat/completions").toString(), "test-api-key");
    }

    @AfterEach
    void tearDown() throws IOException {
        scheduler.dispose();
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("generate should send the conversation and return the raw reply")
    void testGenerateSuccess() throws Exception {
        mockWebServer.enqueue(createMockResponse(200, "A variable stores a value. {TOPIC_COMPLETED}"));

        String result = aiTutorService.generate(CONVERSATION).join();

        assertThat(result).isEqualTo("A variable stores a value. {TOPIC_COMPLETED}");

        // Verify the Request sent to AI
        var recordedRequest = mockWebServer.takeRequest();
        assertThat(recordedRequest.getMethod()).isEqualTo("POST");
        assertThat(recordedRequest.getHeader("Authorization")).isEqualTo("Bearer test-api-key");

        var requestBody = objectMapper.readTree(recordedRequest.getBody().readUtf8());
        assertThat(requestBody.get("model").asText()).contains("qwen");
        assertThat(requestBody.get("max_tokens").asInt()).isEqualTo(2048);
        assertThat(requestBody.get("temperature").asDouble()).isEqualTo(0.7);

        var messages = requestBody.get("messages");
        assertThat(messages).hasSize(3);
        assertThat(messages.get(0).get("role").asText()).isEqualTo("system");
        assertThat(messages.get(1).get("role").asText()).isEqualTo("assistant");
        assertThat(messages.get(2).get("role").asText()).isEqualTo("user");
        assertThat(messages.get(2).get("content").asText()).isEqualTo("What is a variable?");
    }

    @Test
    @DisplayName("A transient 500 is retried once")
    void testRetriesServerError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500).setBody("Internal Server Error"));
        mockWebServer.enqueue(createMockResponse(200, "Second time lucky."));

        assertThat(aiTutorService.generate(CONVERSATION).join()).isEqualTo("Second time lucky.");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should fail with GenerationFailureException when the API keeps returning 500")
    void testApiError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));
        mockWebServer.enqueue(new MockResponse().setResponseCode(500));

        var future = aiTutorService.generate(CONVERSATION);

        assertThatThrownBy(future::join)
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(GenerationFailureException.class)
                .hasMessageContaining("Could not get a response from the AI")
                .hasMessageContaining("failed with code 500");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Client errors are not retried")
    void testClientError() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(() -> aiTutorService.generate(CONVERSATION).join())
                .hasCauseInstanceOf(GenerationFailureException.class);
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("An empty reply is a non-retryable failure")
    void testEmptyReply() {
        mockWebServer.enqueue(createMockResponse(200, "   "));

        assertThatThrownBy(() -> aiTutorService.generate(CONVERSATION).join())
                .cause()
                .isInstanceOf(GenerationFailureException.class)
                .hasMessageContaining("AI returned empty response");
        assertThat(mockWebServer.getRequestCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should handle network timeouts/failures")
    void testNetworkFailure() {
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
        mockWebServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        assertThatThrownBy(() -> aiTutorService.generate(CONVERSATION).join())
                .cause()
                .isInstanceOf(GenerationFailureException.class)
                .hasMessageContaining("Could not get a response from the AI");
    }

    // --- Helper Methods ---

    /**
     * Helper to construct the exact JSON structure the service expects from the AI provider (OpenAI/Fireworks format).
     */
    private MockResponse createMockResponse(int statusCode, String content) {
        try {
            // Structure: { "choices": [ { "message": { "content": "..." } } ] }
            var messageNode = objectMapper.createObjectNode();
            messageNode.put("content", content);

            var choiceNode = objectMapper.createObjectNode();
            choiceNode.set("message", messageNode);

            var choicesArray = objectMapper.createArrayNode();
            choicesArray.add(choiceNode);

            var rootNode = objectMapper.createObjectNode();
            rootNode.set("choices", choicesArray);

            return new MockResponse()
                    .setResponseCode(statusCode)
                    .setHeader("Content-Type", "application/json")
                    .setBody(objectMapper.writeValueAsString(rootNode));
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }
}
