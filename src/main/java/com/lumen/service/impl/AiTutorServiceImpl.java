package com.lumen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lumen.config.LumenProperties;
import com.lumen.config.LumenProperties.AiSettings;
import com.lumen.exception.GenerationFailureException;
import com.lumen.exception.TutorException;
import com.lumen.model.Turn;
import com.lumen.retry.RetryExecutor;
import com.lumen.retry.RetryExhaustedException;
import com.lumen.retry.RetryPolicy;
import com.lumen.service.api.AiTutorService;
import com.lumen.transport.HttpExchange;
import com.lumen.transport.HttpResponse;
import com.lumen.transport.HttpTransport;
import com.lumen.transport.OkHttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Default implementation of the {@link AiTutorService} communicating with an OpenAI-compatible API.
 * <p>
 * This service manages the lifecycle of AI requests: payload construction from the conversation
 * window, asynchronous HTTP execution, retrying transient provider failures and extracting the
 * reply text. It is configured by default for the Qwen model via the Fireworks AI provider.
 * </p>
 */
@Service
public class AiTutorServiceImpl implements AiTutorService {

    private static final Logger log = LoggerFactory.getLogger(AiTutorServiceImpl.class);

    private final HttpTransport transport;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final AiSettings settings;
    private final RetryPolicy retryPolicy;
    private final String apiUrl;
    private final String apiToken;

    /**
     * Initializes the AI service with the necessary HTTP client configuration and API credentials.
     *
     * @param objectMapper  The Jackson mapper used for serializing requests and deserializing responses.
     * @param retryExecutor Executor applying the AI retry policy.
     * @param properties    Application settings; the {@code app.ai.*} group is used.
     * @param apiUrl        The target URL for the AI provider's chat completion endpoint.
     * @param apiToken      The authorization token (Bearer token) for the API.
     */
    @Autowired
    public AiTutorServiceImpl(ObjectMapper objectMapper,
                              RetryExecutor retryExecutor,
                              LumenProperties properties,
                              @Value("${app.ai.api-url}") String apiUrl,
                              @Value("${app.ai.api-key}") String apiToken) {
        this(OkHttpTransport.withTimeout(properties.ai().timeout()),
                retryExecutor, objectMapper, properties.ai(), apiUrl, apiToken);
    }

    AiTutorServiceImpl(HttpTransport transport,
                       RetryExecutor retryExecutor,
                       ObjectMapper objectMapper,
                       AiSettings settings,
                       String apiUrl,
                       String apiToken) {
        this.transport = transport;
        this.retryExecutor = retryExecutor;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.retryPolicy = settings.retry().toPolicy();
        this.apiUrl = apiUrl;
        this.apiToken = apiToken;
    }

    /**
     * {@inheritDoc}
     * <p>
     * Transient provider failures (network errors, timeouts, 5xx, 429) are retried under the
     * {@code app.ai.retry} policy. Client errors and empty replies are not.
     * </p>
     */
    @Override
    public CompletableFuture<String> generate(List<Turn> turns) {
        String requestBodyJson;
        try {
            requestBodyJson = objectMapper.writeValueAsString(createPayload(turns));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new GenerationFailureException("Could not serialize AI request", e));
        }

        log.debug("Requesting AI reply for {} turn(s)", turns.size());
        var exchange = HttpExchange.post(apiUrl, Map.of("Authorization", "Bearer " + apiToken), requestBodyJson);

        return retryExecutor.execute(() -> transport.exchange(exchange).thenApply(this::extractContent), retryPolicy)
                .handle((content, error) -> {
                    if (error == null) {
                        log.info("Received AI reply: {} characters", content.length());
                        return content;
                    }
                    throw toGenerationFailure(error);
                });
    }

    /**
     * Constructs the chat completion payload, mapping each turn onto a role/content message.
     */
    private ObjectNode createPayload(List<Turn> turns) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", settings.model());

        ArrayNode messages = objectMapper.createArrayNode();
        for (Turn turn : turns) {
            ObjectNode message = objectMapper.createObjectNode();
            message.put("role", turn.role().wireName());
            message.put("content", turn.content());
            messages.add(message);
        }

        payload.set("messages", messages);
        payload.put("max_tokens", settings.maxTokens());
        payload.put("temperature", settings.temperature());
        return payload;
    }

    /**
     * Pulls {@code choices[0].message.content} out of a chat completion response.
     *
     * @throws IllegalStateException if the body is not JSON or carries no content; not retried.
     */
    private String extractContent(HttpResponse response) {
        JsonNode responseNode;
        try {
            responseNode = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse AI response: " + e.getOriginalMessage(), e);
        }

        String content = responseNode.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            log.error("AI returned an empty reply: {}", response.body());
            throw new IllegalStateException("AI returned empty response.");
        }
        return content;
    }

    private RuntimeException toGenerationFailure(Throwable error) {
        Throwable failure = TutorException.unwrap(error);
        if (failure instanceof CancellationException cancellation) {
            return cancellation;
        }
        if (failure instanceof RetryExhaustedException exhausted) {
            log.error("AI generation failed after {} attempt(s): {}", exhausted.getAttempts(), exhausted.getCause().getMessage());
            return new GenerationFailureException(
                    "Could not get a response from the AI: " + exhausted.getCause().getMessage(), exhausted);
        }
        return new GenerationFailureException("Could not get a response from the AI: " + failure.getMessage(), failure);
    }
}
