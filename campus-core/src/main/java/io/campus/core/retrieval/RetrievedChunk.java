package io.campus.core.retrieval;

/**
 * A passage returned for one query. Higher score means more relevant.
 */
public record RetrievedChunk(String sourceId, String title, String text, double score) {
    public RetrievedChunk {
        sourceId = sourceId == null ? "" : sourceId;
        title = title == null || title.isBlank() ? sourceId : title.trim();
        text = text == null ? "" : text;
        if (Double.isNaN(score)) {
            score = 0.0;
        }
    }

    public boolean faq() {
        return sourceId.startsWith(KnowledgeIngestor.FAQ_PREFIX);
    }
}
