package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StorageConfig(
    String backend,
    String databasePath,
    String knowledgePath,
    String auditPath
) {

    public static StorageConfig defaults() {
        return new StorageConfig("sqlite", "chatbot.db", "knowledge/chunks.json", "observability/audit-events.jsonl");
    }

    public boolean inMemory() {
        return "memory".equalsIgnoreCase(backend);
    }
}
