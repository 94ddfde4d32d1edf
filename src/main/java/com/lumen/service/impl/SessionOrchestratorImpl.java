package com.lumen.service.impl;

import com.lumen.config.LumenProperties;
import com.lumen.exception.ContextUnavailableException;
import com.lumen.exception.GenerationFailureException;
import com.lumen.exception.NotFoundException;
import com.lumen.exception.SessionConflictException;
import com.lumen.exception.SessionNotActiveException;
import com.lumen.exception.TutorException;
import com.lumen.model.DetectionResult;
import com.lumen.model.MessageReply;
import com.lumen.model.Session;
import com.lumen.model.SessionContext;
import com.lumen.model.SessionDetails;
import com.lumen.model.SessionStart;
import com.lumen.model.SessionStatus;
import com.lumen.model.SessionWarning;
import com.lumen.model.Turn;
import com.lumen.model.TurnRole;
import com.lumen.persistence.SessionRepository;
import com.lumen.service.api.AiTutorService;
import com.lumen.service.api.ConversationStore;
import com.lumen.service.api.ExternalStateGateway;
import com.lumen.service.api.PromptBuilder;
import com.lumen.service.api.SessionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Implementation of {@link SessionOrchestrator} driving sessions through their lifecycle.
 * <p>
 * Operations on one session are queued through a {@link SessionSerializer}, so a learner
 * message, its AI reply and any resulting status change are applied as one unit before the
 * next call on that session starts. Starts are queued per user, topic and course instead,
 * which keeps the one-active-session rule intact under concurrent starts.
 * </p>
 * <p>
 * Nothing is rolled back: a turn that was appended or a transition that was committed stays,
 * even if a later step of the same call fails.
 * </p>
 */
@Service
public class SessionOrchestratorImpl implements SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestratorImpl.class);

    private final ExternalStateGateway gateway;
    private final PromptBuilder promptBuilder;
    private final ConversationStore conversationStore;
    private final AiTutorService aiTutorService;
    private final CompletionDetector completionDetector;
    private final SessionRepository repository;
    private final Clock clock;

    private final String completionMarker;
    private final int maxContextTurns;
    private final int maxMessageLength;

    private final SessionSerializer serializer = new SessionSerializer();

    public SessionOrchestratorImpl(ExternalStateGateway gateway,
                                   PromptBuilder promptBuilder,
                                   ConversationStore conversationStore,
                                   AiTutorService aiTutorService,
                                   CompletionDetector completionDetector,
                                   SessionRepository repository,
                                   LumenProperties properties,
                                   Clock clock) {
        this.gateway = gateway;
        this.promptBuilder = promptBuilder;
        this.conversationStore = conversationStore;
        this.aiTutorService = aiTutorService;
        this.completionDetector = completionDetector;
        this.repository = repository;
        this.clock = clock;
        this.completionMarker = properties.session().completionMarker();
        this.maxContextTurns = properties.session().maxContextTurns();
        this.maxMessageLength = properties.session().maxMessageLength();
    }

    /**
     * {@inheritDoc}
     * <p>
     * User and topic are fetched in parallel. The opening message is generated from the system
     * instruction alone; if that fails the session still stands and the result carries
     * {@link SessionWarning#OPENING_MESSAGE_UNAVAILABLE}.
     * </p>
     */
    @Override
    public CompletableFuture<SessionStart> start(long userId, long topicId, long courseId) {
        if (userId <= 0 || topicId <= 0 || courseId <= 0) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Ids must be positive; got user %d, topic %d, course %d".formatted(userId, topicId, courseId)));
        }
        String key = "start:%d:%d:%d".formatted(userId, topicId, courseId);
        return serializer.submit(key, () -> {
            var existing = repository.findActive(userId, topicId, courseId);
            if (existing.isPresent()) {
                log.warn("User {} already has active session {} on topic {}", userId, existing.get().id(), topicId);
                return CompletableFuture.failedFuture(new SessionConflictException(existing.get().id()));
            }

            var user = gateway.fetchUserContext(userId);
            var topic = gateway.fetchTopicSpec(topicId);

            return user.thenCombine(topic, (userContext, topicSpec) -> SessionContext.capture(topicSpec, userContext))
                    .exceptionally(error -> {
                        Throwable failure = TutorException.unwrap(error);
                        log.warn("Could not load context for user {} on topic {}: {}", userId, topicId, failure.getMessage());
                        throw new ContextUnavailableException(
                                "Could not load context for user %d on topic %d".formatted(userId, topicId), failure);
                    })
                    .thenCompose(context -> open(userId, topicId, courseId, context));
        });
    }

    private CompletableFuture<SessionStart> open(long userId, long topicId, long courseId, SessionContext context) {
        Session session = Session.start(UUID.randomUUID().toString(), userId, topicId, courseId, clock.instant());
        repository.insert(session, context);

        Turn systemTurn = conversationStore.append(session.id(), TurnRole.SYSTEM,
                promptBuilder.build(context, completionMarker));
        log.info("Started session {} for user {} on topic {} (course {})", session.id(), userId, topicId, courseId);

        return generate(session.id(), List.of(systemTurn)).handle((reply, error) -> {
            if (error != null) {
                log.warn("Session {} started without an opening message", session.id());
                return new SessionStart(session, null, Set.of(SessionWarning.OPENING_MESSAGE_UNAVAILABLE));
            }
            // The opening message never completes a session, so the marker is not kept.
            String opening = completionDetector.strip(reply, completionMarker);
            conversationStore.append(session.id(), TurnRole.ASSISTANT, opening);
            return new SessionStart(session, opening, Set.of());
        });
    }

    @Override
    public CompletableFuture<MessageReply> postMessage(String sessionId, String userText) {
        if (userText == null || userText.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Message must not be blank"));
        }
        if (userText.length() > maxMessageLength) {
            return CompletableFuture.failedFuture(new IllegalArgumentException(
                    "Message is %d characters long; the limit is %d".formatted(userText.length(), maxMessageLength)));
        }

        return serializer.submit(sessionId, () -> {
            Session session = requireSession(sessionId);
            if (!session.isActive()) {
                return CompletableFuture.failedFuture(new SessionNotActiveException(sessionId, session.status()));
            }

            conversationStore.append(sessionId, TurnRole.USER, userText);
            List<Turn> window = conversationStore.readForContext(sessionId, maxContextTurns);

            return generate(sessionId, window).thenCompose(reply -> handleReply(session, reply));
        });
    }

    private CompletableFuture<MessageReply> handleReply(Session session, String reply) {
        Turn assistantTurn = conversationStore.append(session.id(), TurnRole.ASSISTANT, reply);
        DetectionResult detection = completionDetector.detect(reply, completionMarker);

        if (!detection.completed()) {
            return CompletableFuture.completedFuture(new MessageReply(
                    session, detection.cleanedText(), false, assistantTurn.timestamp(), Set.of()));
        }

        Session completed = session.complete(clock.instant());
        if (!repository.updateStatus(session.id(), SessionStatus.ACTIVE, completed)) {
            Session current = requireSession(session.id());
            log.warn("Session {} changed to {} before it could be completed", session.id(), current.status());
            return CompletableFuture.completedFuture(new MessageReply(
                    current, detection.cleanedText(), false, assistantTurn.timestamp(), Set.of()));
        }
        log.info("Session {} completed topic {} for user {}", session.id(), session.topicId(), session.userId());

        return gateway.notifyCompletion(completed.userId(), completed.topicId(), completed.courseId(),
                        completed.id(), completed.completedAt())
                .handle((ignored, error) -> {
                    Set<SessionWarning> warnings = Set.of();
                    if (error != null) {
                        log.warn("Completion of session {} could not be reported to the backend: {}",
                                completed.id(), TutorException.unwrap(error).getMessage());
                        warnings = Set.of(SessionWarning.COMPLETION_NOTIFICATION_FAILED);
                    }
                    return new MessageReply(completed, detection.cleanedText(), true, assistantTurn.timestamp(), warnings);
                });
    }

    @Override
    public CompletableFuture<Session> abandon(String sessionId) {
        return serializer.submit(sessionId, () -> {
            Session session = requireSession(sessionId);
            if (session.status().isTerminal()) {
                log.debug("Session {} is already {}; nothing to abandon", sessionId, session.status());
                return CompletableFuture.completedFuture(session);
            }

            Session abandoned = session.abandon();
            if (!repository.updateStatus(sessionId, SessionStatus.ACTIVE, abandoned)) {
                return CompletableFuture.completedFuture(requireSession(sessionId));
            }
            log.info("Abandoned session {}", sessionId);
            return CompletableFuture.completedFuture(abandoned);
        });
    }

    @Override
    public CompletableFuture<SessionDetails> getSession(String sessionId) {
        try {
            Session session = requireSession(sessionId);
            SessionContext context = repository.findContext(sessionId).orElse(null);
            List<Turn> visible = conversationStore.readAll(sessionId).stream()
                    .filter(turn -> turn.role() != TurnRole.SYSTEM)
                    .map(turn -> turn.role() == TurnRole.ASSISTANT
                            ? turn.withContent(completionDetector.strip(turn.content(), completionMarker))
                            : turn)
                    .toList();
            return CompletableFuture.completedFuture(new SessionDetails(session, context, visible));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Requests a reply from the AI, normalizing every failure to {@link GenerationFailureException}.
     */
    private CompletableFuture<String> generate(String sessionId, List<Turn> window) {
        return aiTutorService.generate(window).handle((reply, error) -> {
            if (error == null) {
                if (reply == null || reply.isBlank()) {
                    throw new GenerationFailureException("AI returned an empty reply for session " + sessionId, null);
                }
                return reply;
            }

            Throwable failure = TutorException.unwrap(error);
            log.warn("AI reply for session {} failed: {}", sessionId, failure.getMessage());
            if (failure instanceof GenerationFailureException generationFailure) {
                throw generationFailure;
            }
            if (failure instanceof CancellationException cancellation) {
                throw cancellation;
            }
            throw new GenerationFailureException("Could not get a response from the AI", failure);
        });
    }

    private Session requireSession(String sessionId) {
        return repository.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Session not found: " + sessionId));
    }
}
