package com.lumen.service.api;

import com.lumen.model.Turn;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Defines the contract for the Generative AI provider that voices the tutor.
 * <p>
 * This interface abstracts the underlying Large Language Model (LLM) integration. Given the
 * ordered conversation window (system instruction first), it produces the tutor's next reply.
 * Implementations handle HTTP communication, authentication and their own transient-failure
 * retries.
 * </p>
 */
public interface AiTutorService {

    /**
     * Generates the next assistant reply for a conversation.
     *
     * @param turns The ordered conversation window, starting with the system turn.
     * @return A future with the raw reply text, exactly as the model produced it (completion
     *         marker included), or failed with {@link com.lumen.exception.GenerationFailureException}.
     */
    CompletableFuture<String> generate(List<Turn> turns);
}
