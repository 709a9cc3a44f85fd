package io.campus.core.retrieval;

import java.util.List;

public interface Retriever {
    /**
     * Returns at most {@code k} chunks ordered by non-increasing score. An empty list means no match.
     *
     * @throws RetrievalUnavailableException only when the knowledge store cannot be reached at all
     */
    List<RetrievedChunk> query(String pivotText, int k) throws RetrievalUnavailableException;
}
