package com.shelf.matching.retrieval;

import com.shelf.matching.core.model.Candidate;

import java.util.List;

/**
 * External catalog search capability.
 *
 * <p>Implementations are called concurrently from many pipelines and must be
 * thread-safe. Transport failures should surface as {@link RetrievalException};
 * any other runtime exception is wrapped into one by the pipeline. A worker
 * thread interrupted while blocked in {@link #retrieve} has been cancelled and
 * should abandon the call.</p>
 */
public interface RetrievalProvider {

    /**
     * Searches the catalog.
     *
     * @param query the search request
     * @return candidates in relevance order, possibly empty, never null
     */
    List<Candidate> retrieve(SearchQuery query);

    /**
     * Returns the name of this provider, used in logs and traces.
     */
    default String getProviderName() {
        return getClass().getSimpleName();
    }
}
