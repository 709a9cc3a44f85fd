package io.campus.core.observability;

import java.io.IOException;
import java.util.List;

public interface AuditStore {
    /**
     * Returns retained events, oldest first.
     */
    List<AuditEvent> load() throws IOException;

    /**
     * Adds one event without rewriting the ones already stored.
     */
    void append(AuditEvent event) throws IOException;
}
