package com.agentbacktest.common.cache;

public record CacheStats(
    long hits,
    long misses,
    long evictions,
    long expirations,
    int size
) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
