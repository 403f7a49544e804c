package com.shelf.matching.retrieval;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.shelf.matching.core.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Caffeine-backed decorator that memoizes catalog searches per normalized search term.
 * Shelves repeat the same product many times, so a batch often issues identical
 * queries; only the first reaches the rate-limited search service.
 *
 * <p>A null result is cached as an empty list. Failed searches are not cached. Concurrent lookups of the same term wait for
 * the one in progress.</p>
 */
public class CachingRetrievalProvider implements RetrievalProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingRetrievalProvider.class);

    private final RetrievalProvider delegate;
    private final Cache<CacheKey, List<Candidate>> cache;
    private final boolean enabled;

    public CachingRetrievalProvider(RetrievalProvider delegate, RetrievalCacheConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        Objects.requireNonNull(config, "config is required");
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxTerms())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("CachingRetrievalProvider initialized: delegate={}, enabled={}, maxTerms={}, ttl={}",
                delegate.getProviderName(), enabled, config.maxTerms(), config.ttl());
    }

    @Override
    public List<Candidate> retrieve(SearchQuery query) {
        if (!enabled || query.isBlank()) {
            return delegate.retrieve(query);
        }
        CacheKey key = CacheKey.of(query);
        return cache.get(key, k -> {
            log.debug("retrieval.cache.miss term='{}' provider={}", k.term(), delegate.getProviderName());
            List<Candidate> candidates = delegate.retrieve(query);
            return candidates == null ? List.of() : List.copyOf(candidates);
        });
    }

    @Override
    public String getProviderName() {
        return "Caching(" + delegate.getProviderName() + ")";
    }

    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all retrieval cache entries");
    }

    public RetrievalCacheStats getStats() {
        CacheStats stats = cache.stats();
        return new RetrievalCacheStats(stats.hitCount(), stats.missCount(), stats.loadFailureCount(),
                stats.evictionCount(), cache.estimatedSize());
    }

    /**
     * Cache key: case- and whitespace-insensitive search term and retailer, plus the result cap.
     */
    record CacheKey(String term, String retailer, int maxResults) {
        static CacheKey of(SearchQuery query) {
            return new CacheKey(fold(query.term()), fold(query.retailer()), query.maxResults());
        }

        private static String fold(String value) {
            return value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        }
    }
}
