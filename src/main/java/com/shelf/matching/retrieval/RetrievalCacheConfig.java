package com.shelf.matching.retrieval;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the catalog search cache in front of a {@link RetrievalProvider}.
 *
 * @param maxTerms maximum number of distinct search terms kept
 * @param ttl      how long a search result stays valid after it was fetched
 * @param enabled  whether searches are cached at all
 */
public record RetrievalCacheConfig(int maxTerms, Duration ttl, boolean enabled) {

    public RetrievalCacheConfig {
        Objects.requireNonNull(ttl, "ttl is required");
        if (maxTerms <= 0) {
            throw new IllegalArgumentException("maxTerms must be > 0");
        }
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /**
     * 1,000 search terms, each kept for ten minutes.
     */
    public static RetrievalCacheConfig defaults() {
        return of(1_000, Duration.ofMinutes(10));
    }

    public static RetrievalCacheConfig of(int maxTerms, Duration ttl) {
        return new RetrievalCacheConfig(maxTerms, ttl, true);
    }

    public static RetrievalCacheConfig disabled() {
        return new RetrievalCacheConfig(1, Duration.ofSeconds(1), false);
    }
}
