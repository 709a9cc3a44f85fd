package io.campus.core.retrieval;

import java.util.List;

public record KnowledgeChunk(String documentId, String sourceId, String title, String text, List<Double> embedding) {
    public KnowledgeChunk {
        documentId = documentId == null ? "" : documentId;
        sourceId = sourceId == null || sourceId.isBlank() ? documentId : sourceId;
        title = title == null ? "" : title;
        text = text == null ? "" : text;
        embedding = embedding == null ? List.of() : List.copyOf(embedding);
    }

    public static KnowledgeChunk of(String sourceId, String title, String text) {
        return new KnowledgeChunk("", sourceId, title, text, List.of());
    }
}
