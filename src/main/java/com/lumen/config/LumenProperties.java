package com.lumen.config;

import com.lumen.retry.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Typed view of the {@code app.*} properties.
 * <p>
 * These values are threaded into the components that need them at construction time;
 * nothing in the tutoring core reads configuration from global state.
 * </p>
 */
@ConfigurationProperties(prefix = "app")
public record LumenProperties(@DefaultValue SessionSettings session,
                              @DefaultValue UpstreamSettings upstream,
                              @DefaultValue AiSettings ai,
                              StorageSettings storage) {

    /**
     * @param completionMarker Token the AI emits once the learner has mastered the topic.
     * @param maxContextTurns  Size of the replay window sent to the AI, system instruction included.
     * @param maxMessageLength Longest accepted learner message, in characters.
     */
    public record SessionSettings(@DefaultValue("{TOPIC_COMPLETED}") String completionMarker,
                                  @DefaultValue("50") int maxContextTurns,
                                  @DefaultValue("5000") int maxMessageLength) {
    }

    /**
     * Connection to the training backend that owns user and progress data.
     */
    public record UpstreamSettings(@DefaultValue("http://localhost:8080") String baseUrl,
                                   String apiKey,
                                   @DefaultValue("30s") Duration timeout,
                                   @DefaultValue RetrySettings retry) {
    }

    public record AiSettings(@DefaultValue("accounts/fireworks/models/qwen3-coder-30b-a3b-instruct") String model,
                             @DefaultValue("0.7") double temperature,
                             @DefaultValue("2048") int maxTokens,
                             @DefaultValue("60s") Duration timeout,
                             @DefaultValue RetrySettings retry) {
    }

    public record RetrySettings(@DefaultValue("5") int maxAttempts,
                                @DefaultValue("1s") Duration baseDelay,
                                @DefaultValue("30s") Duration maxDelay,
                                @DefaultValue("2.0") double multiplier) {

        public RetryPolicy toPolicy() {
            return RetryPolicy.of(maxAttempts, baseDelay, maxDelay, multiplier);
        }
    }

    public record StorageSettings(String dir) {
    }
}
