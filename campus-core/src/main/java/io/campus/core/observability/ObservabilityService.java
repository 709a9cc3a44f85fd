package io.campus.core.observability;

import io.campus.core.escalation.EscalationSink;
import io.campus.core.retrieval.KnowledgeStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Audit trail and dashboard figures. Holds no lock of its own; the store decides how appends are ordered.
 */
public final class ObservabilityService {
    public static final String CHAT_COMPLETED = "chat_completed";
    public static final String CHAT_FAILED = "chat_failed";
    static final Duration ACTIVE_WINDOW = Duration.ofHours(24);
    static final Duration CONFIDENCE_WINDOW = Duration.ofDays(7);

    private final AuditStore store;
    private final Clock clock;
    private final EscalationSink escalations;
    private final KnowledgeStore knowledge;

    public ObservabilityService(AuditStore store, Clock clock) {
        this(store, clock, null, null);
    }

    public ObservabilityService(AuditStore store, Clock clock, EscalationSink escalations, KnowledgeStore knowledge) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.escalations = escalations;
        this.knowledge = knowledge;
    }

    public AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        AuditEvent event = new AuditEvent(UUID.randomUUID().toString(), clock.instant(), type, attributes);
        store.append(event);
        return event;
    }

    public List<AuditEvent> recent(int limit) throws IOException {
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(Math.max(1, limit))
            .toList();
    }

    public DashboardSummary summary() throws IOException {
        List<AuditEvent> all = store.load();
        List<AuditEvent> chats = all.stream().filter(e -> CHAT_COMPLETED.equalsIgnoreCase(e.type())).toList();

        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());
        Instant activeSince = now.minus(ACTIVE_WINDOW);
        Instant confidenceSince = now.minus(CONFIDENCE_WINDOW);

        int escalated = 0;
        int degraded = 0;
        int messagesToday = 0;
        Average confidence = new Average();
        Average recentConfidence = new Average();
        Set<String> sessions = new HashSet<>();
        Set<String> activeSessions = new HashSet<>();
        Map<String, Integer> languages = new TreeMap<>();
        Map<String, Integer> intents = new TreeMap<>();
        for (AuditEvent chat : chats) {
            Map<String, Object> attributes = chat.attributes();
            if (Boolean.TRUE.equals(attributes.get("escalated"))) {
                escalated++;
            }
            Object degradations = attributes.get("degradations");
            if (degradations instanceof List<?> list && !list.isEmpty()) {
                degraded++;
            }
            if (LocalDate.ofInstant(chat.timestamp(), clock.getZone()).equals(today)) {
                messagesToday++;
            }
            Double score = toDouble(attributes.get("confidence"));
            if (score != null) {
                confidence.add(score);
                if (!chat.timestamp().isBefore(confidenceSince)) {
                    recentConfidence.add(score);
                }
            }
            String session = str(attributes.get("session_id"));
            if (!session.isBlank()) {
                sessions.add(session);
                if (!chat.timestamp().isBefore(activeSince)) {
                    activeSessions.add(session);
                }
            }
            count(languages, str(attributes.get("detected_language")));
            count(intents, str(attributes.get("intent")));
        }

        int total = chats.size();
        return new DashboardSummary(
            total,
            messagesToday,
            escalated,
            total == 0 ? 0.0 : round2(escalated * 100.0 / total),
            escalations == null ? 0 : escalations.pending().size(),
            confidence.value(),
            recentConfidence.value(),
            degraded,
            sessions.size(),
            activeSessions.size(),
            knowledge == null ? 0 : knowledge.count(),
            languages,
            intents,
            all.size()
        );
    }

    private void count(Map<String, Integer> counts, String key) {
        if (!key.isBlank()) {
            counts.merge(key, 1, Integer::sum);
        }
    }

    private String str(Object value) {
        return value == null ? "" : String.valueOf(value).trim();
    }

    private Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static final class Average {
        private double total;
        private int count;

        void add(double value) {
            total += value;
            count++;
        }

        double value() {
            return count == 0 ? 0.0 : round2(total / count);
        }
    }
}
