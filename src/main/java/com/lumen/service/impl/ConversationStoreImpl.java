package com.lumen.service.impl;

import com.lumen.model.Turn;
import com.lumen.model.TurnRole;
import com.lumen.persistence.SessionRepository;
import com.lumen.service.api.ConversationStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ConversationStore} on top of the {@link SessionRepository}.
 * <p>
 * Truncation is a read-time view: turns outside the window stay stored and are still
 * returned by {@link #readAll(String)}.
 * </p>
 */
@Service
public class ConversationStoreImpl implements ConversationStore {

    private final SessionRepository repository;
    private final Clock clock;

    public ConversationStoreImpl(SessionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Turn append(String sessionId, TurnRole role, String content) {
        return repository.appendTurn(sessionId, role, content, clock.instant());
    }

    @Override
    public List<Turn> readForContext(String sessionId, int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("maxTurns must be at least 1, got " + maxTurns);
        }

        List<Turn> all = repository.findTurns(sessionId);
        List<Turn> window = new ArrayList<>(Math.min(all.size(), maxTurns));
        List<Turn> conversation = new ArrayList<>(all.size());
        for (Turn turn : all) {
            if (turn.role() == TurnRole.SYSTEM) {
                window.add(turn);
            } else {
                conversation.add(turn);
            }
        }

        int keep = maxTurns - window.size();
        int from = Math.max(0, conversation.size() - Math.max(keep, 0));
        window.addAll(conversation.subList(from, conversation.size()));
        return List.copyOf(window);
    }

    @Override
    public List<Turn> readAll(String sessionId) {
        return repository.findTurns(sessionId);
    }
}
