package io.campus.core.session;

import io.campus.core.model.Turn;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemorySessionStore implements SessionHistory {
    private final Map<String, Session> sessions = new HashMap<>();
    private final Map<String, List<Turn>> turns = new HashMap<>();

    @Override
    public synchronized Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized List<Turn> loadHistory(String sessionId, int limit) {
        List<Turn> all = turns.getOrDefault(sessionId, List.of());
        if (limit <= 0 || all.isEmpty()) {
            return List.of();
        }
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    @Override
    public synchronized void appendTurns(Session session, List<Turn> newTurns) {
        sessions.put(session.id(), session);
        turns.computeIfAbsent(session.id(), key -> new ArrayList<>()).addAll(newTurns);
    }

    public synchronized int turnCount(String sessionId) {
        return turns.getOrDefault(sessionId, List.of()).size();
    }
}
