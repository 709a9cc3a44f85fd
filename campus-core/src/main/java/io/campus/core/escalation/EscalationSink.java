package io.campus.core.escalation;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface EscalationSink {
    /**
     * Opens a pending escalation for the session.
     */
    EscalationRecord create(String sessionId, EscalationReason reason) throws IOException;

    List<EscalationRecord> pending() throws IOException;

    Optional<EscalationRecord> resolve(String id, String assignee) throws IOException;
}
