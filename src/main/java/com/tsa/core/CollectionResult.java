package com.tsa.core;

import com.tsa.condition.ConditionId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Results of the conditions of one collection that could be evaluated, in
 * collection order.
 */
public final class CollectionResult {

    private final CondCollection collection;
    private final Map<ConditionId, ConditionResult> results;

    public CollectionResult(CondCollection collection, Map<ConditionId, ConditionResult> results) {
        this.collection = collection;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public CondCollection getCollection() {
        return collection;
    }

    public ConditionResult get(ConditionId id) {
        return results.get(id);
    }

    public ConditionResult get(String key) {
        return results.values().stream()
                .filter(r -> r.getCondition().getId().key().equals(key))
                .findFirst()
                .orElse(null);
    }

    public List<ConditionResult> getResults() {
        return List.copyOf(results.values());
    }

    public int size() {
        return results.size();
    }

    /**
     * Whether every condition of the collection was evaluated.
     */
    public boolean isComplete() {
        return results.size() == collection.size();
    }
}
