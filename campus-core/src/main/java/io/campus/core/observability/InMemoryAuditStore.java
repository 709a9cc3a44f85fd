package io.campus.core.observability;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public final class InMemoryAuditStore implements AuditStore {
    private final Deque<AuditEvent> events = new ArrayDeque<>();
    private final int maxEvents;

    public InMemoryAuditStore() {
        this(FileAuditStore.DEFAULT_MAX_EVENTS);
    }

    public InMemoryAuditStore(int maxEvents) {
        this.maxEvents = Math.max(1, maxEvents);
    }

    @Override
    public synchronized List<AuditEvent> load() {
        return List.copyOf(events);
    }

    @Override
    public synchronized void append(AuditEvent event) {
        events.addLast(event);
        while (events.size() > maxEvents) {
            events.removeFirst();
        }
    }
}
