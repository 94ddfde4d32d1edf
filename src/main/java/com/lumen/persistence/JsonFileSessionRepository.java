package com.lumen.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumen.exception.NotFoundException;
import com.lumen.model.Session;
import com.lumen.model.SessionContext;
import com.lumen.model.SessionStatus;
import com.lumen.model.Turn;
import com.lumen.model.TurnRole;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * {@link SessionRepository} that keeps one JSON document per session in a directory.
 * <p>
 * Documents are cached in memory and rewritten after every mutation. All mutations of a
 * session run inside {@link ConcurrentHashMap#compute}, so writes to the same session are
 * serialized and a failed write leaves the cached state untouched. Existing documents are
 * reloaded on startup so that sessions survive a restart.
 * </p>
 */
public class JsonFileSessionRepository implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSessionRepository.class);

    private static final String FILE_SUFFIX = ".json";

    private final ObjectMapper objectMapper;
    private final Path storageDir;
    private final Map<String, SessionDocument> documents = new ConcurrentHashMap<>();

    public JsonFileSessionRepository(ObjectMapper objectMapper, Path storageDir) {
        this.objectMapper = objectMapper;
        this.storageDir = storageDir;
    }

    /**
     * Loads every session document found in the storage directory.
     * <p>
     * Unreadable files are logged and skipped so one corrupt document does not keep the
     * service from starting.
     * </p>
     */
    @PostConstruct
    public void load() {
        try {
            Files.createDirectories(storageDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create session storage directory " + storageDir, e);
        }

        try (Stream<Path> files = Files.list(storageDir)) {
            files.filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX))
                    .forEach(this::loadDocument);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list session storage directory " + storageDir, e);
        }
        log.info("Loaded {} session(s) from {}", documents.size(), storageDir);
    }

    private void loadDocument(Path path) {
        try {
            SessionDocument document = objectMapper.readValue(path.toFile(), SessionDocument.class);
            documents.put(document.session().id(), document);
        } catch (IOException | RuntimeException e) {
            log.error("Skipping unreadable session file {}: {}", path, e.getMessage());
        }
    }

    @Override
    public void insert(Session session, SessionContext context) {
        documents.compute(session.id(), (id, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Session " + id + " already exists");
            }
            return write(new SessionDocument(session, context, List.of()));
        });
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        return Optional.ofNullable(documents.get(sessionId)).map(SessionDocument::session);
    }

    @Override
    public Optional<SessionContext> findContext(String sessionId) {
        return Optional.ofNullable(documents.get(sessionId)).map(SessionDocument::context);
    }

    @Override
    public Optional<Session> findActive(long userId, long topicId, long courseId) {
        return documents.values().stream()
                .map(SessionDocument::session)
                .filter(Session::isActive)
                .filter(s -> s.userId() == userId && s.topicId() == topicId && s.courseId() == courseId)
                .findFirst();
    }

    @Override
    public boolean updateStatus(String sessionId, SessionStatus expected, Session updated) {
        AtomicBoolean applied = new AtomicBoolean(false);
        documents.computeIfPresent(sessionId, (id, existing) -> {
            if (existing.session().status() != expected) {
                return existing;
            }
            applied.set(true);
            return write(existing.withSession(updated));
        });
        return applied.get();
    }

    @Override
    public Turn appendTurn(String sessionId, TurnRole role, String content, Instant at) {
        AtomicReference<Turn> appended = new AtomicReference<>();
        SessionDocument result = documents.computeIfPresent(sessionId, (id, existing) -> {
            Turn turn = new Turn(id, existing.nextSequence(), role, content, at);
            appended.set(turn);
            return write(existing.withTurn(turn));
        });
        if (result == null) {
            throw new NotFoundException("Session " + sessionId + " not found");
        }
        return appended.get();
    }

    @Override
    public List<Turn> findTurns(String sessionId) {
        SessionDocument document = documents.get(sessionId);
        return document != null ? document.turns() : List.of();
    }

    /**
     * Persists a document through a temporary file so readers never see a half-written session.
     */
    private SessionDocument write(SessionDocument document) {
        Path target = storageDir.resolve(document.session().id() + FILE_SUFFIX);
        Path temp = storageDir.resolve(document.session().id() + FILE_SUFFIX + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), document);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to save session {} to {}: {}", document.session().id(), target, e.getMessage());
            throw new UncheckedIOException("Failed to persist session " + document.session().id(), e);
        }
        return document;
    }
}
