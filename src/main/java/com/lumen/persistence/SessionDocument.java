package com.lumen.persistence;

import com.lumen.model.Session;
import com.lumen.model.SessionContext;
import com.lumen.model.Turn;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk shape of one session: the record, its context and its turns.
 */
public record SessionDocument(Session session, SessionContext context, List<Turn> turns) {

    public SessionDocument {
        turns = turns == null ? List.of() : List.copyOf(turns);
    }

    SessionDocument withSession(Session updated) {
        return new SessionDocument(updated, context, turns);
    }

    SessionDocument withTurn(Turn turn) {
        List<Turn> appended = new ArrayList<>(turns.size() + 1);
        appended.addAll(turns);
        appended.add(turn);
        return new SessionDocument(session, context, appended);
    }

    long nextSequence() {
        return turns.isEmpty() ? 0 : turns.get(turns.size() - 1).sequence() + 1;
    }
}
