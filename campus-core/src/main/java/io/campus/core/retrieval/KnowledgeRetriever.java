package io.campus.core.retrieval;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

public final class KnowledgeRetriever implements Retriever {
    private final KnowledgeStore store;
    private final double minScore;

    public KnowledgeRetriever(KnowledgeStore store, double minScore) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.minScore = minScore;
    }

    @Override
    public List<RetrievedChunk> query(String pivotText, int k) throws RetrievalUnavailableException {
        if (k <= 0 || pivotText == null || pivotText.isBlank()) {
            return List.of();
        }
        List<RetrievedChunk> raw;
        try {
            // over-fetch so the score floor does not starve the result
            raw = store.query(pivotText, (int) Math.min(Integer.MAX_VALUE, 2L * k));
        } catch (IOException e) {
            throw new RetrievalUnavailableException("knowledge store unavailable: " + e.getMessage(), e);
        }
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }

        List<RetrievedChunk> kept = new ArrayList<>();
        for (RetrievedChunk chunk : raw) {
            if (chunk != null && chunk.score() >= minScore) {
                kept.add(chunk);
            }
        }
        // List.sort is stable, so ties keep the store's order
        kept.sort(Comparator.comparingDouble(RetrievedChunk::score).reversed());
        return List.copyOf(kept.subList(0, Math.min(k, kept.size())));
    }
}
