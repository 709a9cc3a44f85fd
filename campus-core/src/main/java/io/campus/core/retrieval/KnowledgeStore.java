package io.campus.core.retrieval;

import java.io.IOException;
import java.util.List;

public interface KnowledgeStore {
    /**
     * Replaces every chunk previously indexed under {@code documentId}.
     */
    void index(String documentId, List<KnowledgeChunk> chunks) throws IOException;

    /**
     * Returns at most {@code k} chunks, best first. Equal scores keep insertion order.
     */
    List<RetrievedChunk> query(String text, int k) throws IOException;

    boolean remove(String documentId) throws IOException;

    int count() throws IOException;
}
