package com.shelf.matching.retrieval;

/**
 * Counters of the catalog search cache.
 *
 * @param hits         searches answered from the cache
 * @param misses       searches forwarded to the catalog
 * @param loadFailures forwarded searches that failed and were not cached
 * @param evictions    entries dropped for size or age
 * @param cachedTerms  search terms currently cached
 */
public record RetrievalCacheStats(long hits, long misses, long loadFailures, long evictions, long cachedTerms) {

    public static final RetrievalCacheStats EMPTY = new RetrievalCacheStats(0, 0, 0, 0, 0);

    public long requests() {
        return hits + misses;
    }

    /**
     * Share of searches the catalog did not see, 0.0 before the first request.
     */
    public double hitRate() {
        long requests = requests();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }
}
