package io.campus.core.escalation;

import java.time.Instant;
import java.util.Objects;

public record EscalationRecord(
    String id,
    String sessionId,
    EscalationReason reason,
    EscalationStatus status,
    String assignee,
    Instant createdAt
) {
    public EscalationRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
        status = status == null ? EscalationStatus.PENDING : status;
        assignee = assignee == null || assignee.isBlank() ? null : assignee.trim();
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public EscalationRecord resolve(String by) {
        return new EscalationRecord(id, sessionId, reason, EscalationStatus.RESOLVED, by, createdAt);
    }
}
