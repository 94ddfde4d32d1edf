package com.lumen.model;

import java.util.List;

/**
 * Read model of a session: its state, captured context and learner-visible history.
 *
 * @param turns USER and ASSISTANT turns in order; the system instruction is not included.
 */
public record SessionDetails(Session session, SessionContext context, List<Turn> turns) {
}
