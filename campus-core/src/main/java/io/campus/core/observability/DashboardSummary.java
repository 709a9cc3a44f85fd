package io.campus.core.observability;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record DashboardSummary(
    @JsonProperty("total_messages") int totalMessages,
    @JsonProperty("messages_today") int messagesToday,
    @JsonProperty("escalations") int escalations,
    @JsonProperty("escalation_rate") double escalationRate,
    @JsonProperty("pending_escalations") int pendingEscalations,
    @JsonProperty("average_confidence") double averageConfidence,
    @JsonProperty("average_confidence_7d") double averageConfidence7d,
    @JsonProperty("degraded_turns") int degradedTurns,
    @JsonProperty("total_sessions") int totalSessions,
    @JsonProperty("active_sessions_24h") int activeSessions24h,
    @JsonProperty("knowledge_chunks") int knowledgeChunks,
    @JsonProperty("languages") Map<String, Integer> languages,
    @JsonProperty("intents") Map<String, Integer> intents,
    @JsonProperty("audit_events") int auditEvents
) {
    public DashboardSummary {
        languages = languages == null ? Map.of() : Map.copyOf(languages);
        intents = intents == null ? Map.of() : Map.copyOf(intents);
    }
}
