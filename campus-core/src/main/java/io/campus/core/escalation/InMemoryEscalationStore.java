package io.campus.core.escalation;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class InMemoryEscalationStore implements EscalationSink {
    private final Map<String, EscalationRecord> records = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryEscalationStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEscalationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized EscalationRecord create(String sessionId, EscalationReason reason) {
        EscalationRecord record = new EscalationRecord(
            UUID.randomUUID().toString(), sessionId, reason, EscalationStatus.PENDING, null, clock.instant()
        );
        records.put(record.id(), record);
        return record;
    }

    @Override
    public synchronized List<EscalationRecord> pending() {
        List<EscalationRecord> out = new ArrayList<>();
        for (EscalationRecord record : records.values()) {
            if (record.status() == EscalationStatus.PENDING) {
                out.add(record);
            }
        }
        return out;
    }

    @Override
    public synchronized Optional<EscalationRecord> resolve(String id, String assignee) {
        EscalationRecord existing = records.get(id);
        if (existing == null) {
            return Optional.empty();
        }
        EscalationRecord resolved = existing.resolve(assignee);
        records.put(id, resolved);
        return Optional.of(resolved);
    }

    public synchronized List<EscalationRecord> all() {
        return List.copyOf(records.values());
    }
}
