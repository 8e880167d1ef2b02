package io.vulnscan.cache;

/**
 * Point-in-time counters for a two-tier cache.
 */
public record CacheStats(
    int memoryEntries,
    int memoryCapacity,
    long diskEntries,
    long hits,
    long misses
) {
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
