package com.lumen.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.config.LumenProperties.UpstreamSettings;
import com.lumen.exception.NotFoundException;
import com.lumen.exception.TutorException;
import com.lumen.exception.UpstreamUnavailableException;
import com.lumen.model.CompletionNotice;
import com.lumen.model.TopicSpec;
import com.lumen.model.UserContext;
import com.lumen.retry.FailureClass;
import com.lumen.retry.RetryExecutor;
import com.lumen.retry.RetryExhaustedException;
import com.lumen.retry.RetryPolicy;
import com.lumen.service.api.ExternalStateGateway;
import com.lumen.transport.HttpExchange;
import com.lumen.transport.HttpResponse;
import com.lumen.transport.HttpTransport;
import com.lumen.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * {@link ExternalStateGateway} speaking the training backend's REST API.
 * <p>
 * Each call is a fresh {@link HttpTransport} exchange run through the {@link RetryExecutor}
 * with the upstream retry policy. Response parsing happens inside the retried operation, so
 * an unreadable body is classified (as non-retryable) like any other failure.
 * </p>
 */
public class ExternalStateGatewayImpl implements ExternalStateGateway {

    private static final Logger log = LoggerFactory.getLogger(ExternalStateGatewayImpl.class);

    private static final String USER_CONTEXT_PATH = "/api/UserProgress/%d/context";
    private static final String TOPIC_PATH = "/api/TrainingTopics/%d";
    private static final String COMPLETE_TOPIC_PATH = "/api/UserProgress/complete-topic";
    private static final String HEALTH_PATH = "/api/health";
    private static final String API_KEY_HEADER = "X-API-Key";

    private final HttpTransport transport;
    private final RetryExecutor retryExecutor;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final String baseUrl;
    private final Map<String, String> headers;

    public ExternalStateGatewayImpl(HttpTransport transport,
                                    RetryExecutor retryExecutor,
                                    ObjectMapper objectMapper,
                                    UpstreamSettings settings) {
        this.transport = transport;
        this.retryExecutor = retryExecutor;
        this.objectMapper = objectMapper;
        this.retryPolicy = settings.retry().toPolicy();
        this.baseUrl = settings.baseUrl().endsWith("/")
                ? settings.baseUrl().substring(0, settings.baseUrl().length() - 1)
                : settings.baseUrl();
        this.headers = settings.apiKey() != null && !settings.apiKey().isBlank()
                ? Map.of(API_KEY_HEADER, settings.apiKey())
                : Map.of();
    }

    @Override
    public CompletableFuture<UserContext> fetchUserContext(long userId) {
        String url = baseUrl + USER_CONTEXT_PATH.formatted(userId);
        return call("User " + userId, () -> transport.exchange(HttpExchange.get(url, headers))
                .thenApply(response -> read(response, UserContext.class)));
    }

    @Override
    public CompletableFuture<TopicSpec> fetchTopicSpec(long topicId) {
        String url = baseUrl + TOPIC_PATH.formatted(topicId);
        return call("Topic " + topicId, () -> transport.exchange(HttpExchange.get(url, headers))
                .thenApply(response -> read(response, TopicSpec.class)));
    }

    @Override
    public CompletableFuture<Void> notifyCompletion(long userId, long topicId, long courseId,
                                                    String sessionId, Instant completedAt) {
        String body;
        try {
            body = objectMapper.writeValueAsString(
                    new CompletionNotice(userId, topicId, courseId, sessionId, completedAt));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(
                    new UpstreamUnavailableException("Could not serialize completion notice", 0, false, e));
        }

        String url = baseUrl + COMPLETE_TOPIC_PATH;
        String description = "Completion of topic %d for user %d".formatted(topicId, userId);
        return call(description, () -> transport.exchange(HttpExchange.post(url, headers, body)))
                .thenAccept(response -> log.info(
                        "Notified backend about topic completion: userId={}, topicId={}, sessionId={}",
                        userId, topicId, sessionId));
    }

    @Override
    public CompletableFuture<Boolean> checkHealth() {
        return transport.exchange(HttpExchange.get(baseUrl + HEALTH_PATH, headers))
                .handle((response, error) -> {
                    if (error != null) {
                        log.warn("Backend health check failed: {}", TutorException.unwrap(error).getMessage());
                        return false;
                    }
                    return true;
                });
    }

    private <T> CompletableFuture<T> call(String description, Supplier<CompletableFuture<T>> operation) {
        return retryExecutor.execute(operation, retryPolicy)
                .handle((value, error) -> {
                    if (error == null) {
                        return value;
                    }
                    throw classify(description, error);
                });
    }

    /**
     * Maps a retry outcome onto the gateway's failure taxonomy.
     */
    private RuntimeException classify(String description, Throwable error) {
        Throwable failure = TutorException.unwrap(error);
        if (failure instanceof CancellationException cancellation) {
            return cancellation;
        }
        if (!(failure instanceof RetryExhaustedException exhausted)) {
            return new UpstreamUnavailableException(description + ": unexpected failure", 0, true, failure);
        }

        Throwable last = exhausted.getCause();
        if (last instanceof TransportException transportException && transportException.isNotFound()) {
            log.warn("{} not found on the training backend", description);
            return new NotFoundException(description + " not found", last);
        }

        boolean recoverable = exhausted.getFailureClass() == FailureClass.RETRYABLE;
        log.error("{}: backend call failed after {} attempt(s) ({}): {}",
                description, exhausted.getAttempts(), exhausted.getFailureClass(), last.getMessage());
        return new UpstreamUnavailableException(
                "%s: training backend unavailable after %d attempt(s)".formatted(description, exhausted.getAttempts()),
                exhausted.getAttempts(), recoverable, last);
    }

    private <T> T read(HttpResponse response, Class<T> type) {
        try {
            T value = objectMapper.readValue(response.body(), type);
            if (value == null) {
                throw new IllegalStateException("Empty " + type.getSimpleName() + " response");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable " + type.getSimpleName() + " response: " + e.getOriginalMessage(), e);
        }
    }
}
