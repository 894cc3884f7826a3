package com.assistant.relevance.memory;

import java.util.List;

/**
 * Scores the indexed corpus against a query.
 */
public interface RecallBackend {

    MemoryBackend kind();

    /**
     * Scores every line and returns the candidates worth keeping, in corpus order.
     *
     * @throws RecallBackendException when the backend cannot serve the query
     */
    List<MemoryCandidate> search(RecallQuery query, List<MemoryLine> corpus);
}
