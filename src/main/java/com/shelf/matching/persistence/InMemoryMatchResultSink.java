package com.shelf.matching.persistence;

import com.shelf.matching.core.model.MatchOutcome;
import com.shelf.matching.pipeline.ItemMatchResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link MatchResultSink}. Keeps the latest result per item id.
 * Suitable for testing and single-process runs.
 */
public class InMemoryMatchResultSink implements MatchResultSink {

    private final Map<String, ItemMatchResult> results = new ConcurrentHashMap<>();

    @Override
    public void save(ItemMatchResult result) {
        results.put(result.itemId(), result);
    }

    public Optional<ItemMatchResult> findByItemId(String itemId) {
        return Optional.ofNullable(results.get(itemId));
    }

    public List<ItemMatchResult> findByOutcome(MatchOutcome outcome) {
        return results.values().stream()
                .filter(r -> r.outcome() == outcome)
                .toList();
    }

    public List<ItemMatchResult> findAll() {
        return List.copyOf(results.values());
    }

    public int size() {
        return results.size();
    }

    public void clear() {
        results.clear();
    }
}
