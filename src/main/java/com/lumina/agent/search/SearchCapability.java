package com.lumina.agent.search;

import java.util.List;

/**
 * Ranked retrieval over the user's notes. The ranking itself is the
 * implementation's business; the agent only consumes the hits.
 */
public interface SearchCapability {

    /** False while the index is missing or still being built */
    boolean isReady();

    /**
     * @param query natural-language query
     * @param limit maximum number of hits
     * @return hits ordered by descending score
     */
    List<SearchHit> search(String query, int limit);
}
