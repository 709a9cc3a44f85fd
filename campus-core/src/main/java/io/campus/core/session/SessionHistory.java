package io.campus.core.session;

import io.campus.core.model.Turn;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Session-keyed conversation state. History is append-only.
 */
public interface SessionHistory {
    Optional<Session> find(String sessionId) throws IOException;

    /**
     * Returns the most recent {@code limit} turns in chronological order.
     */
    List<Turn> loadHistory(String sessionId, int limit) throws IOException;

    /**
     * Upserts the session row and appends all turns in one unit. Either every turn is stored or none is.
     */
    void appendTurns(Session session, List<Turn> turns) throws IOException;
}
