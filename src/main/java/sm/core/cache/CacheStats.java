package sm.core.cache;

public record CacheStats(
    boolean enabled,
    int size,
    int maxEntries,
    long hits,
    long misses,
    long evictions,
    long expirations
) {
    public long totalRequests() {
        return hits + misses;
    }

    /** Hit rate in percent, 0 when nothing has been looked up yet. */
    public double hitRate() {
        long total = totalRequests();
        return total == 0 ? 0.0 : hits * 100.0 / total;
    }
}
