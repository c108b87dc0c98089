package com.badu.ai.constraint.cache;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of {@link TokenTransitionCache} counters.
 */
@Value
@Builder
public class CacheStatistics {
    long hits;
    long misses;
    long computations;
    int entries;
    long computeTimeMs;

    /**
     * Hit ratio in {@code [0, 1]}, or 0 before the first query.
     */
    public double getHitRatio() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    @Override
    public String toString() {
        return String.format("CacheStatistics{entries=%d, hits=%d, misses=%d, computations=%d, hitRatio=%.2f, computeTime=%dms}",
            entries, hits, misses, computations, getHitRatio(), computeTimeMs);
    }
}
