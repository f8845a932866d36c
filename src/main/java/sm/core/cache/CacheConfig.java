package sm.core.cache;

import sm.core.model.TtlClass;

import java.time.Duration;

/**
 * Configuration for the query cache.
 *
 * @param enabled When false, lookups always miss and stores are ignored
 * @param maxEntries Entry-count ceiling enforced by LRU eviction
 * @param longTtl Time-to-live of {@link TtlClass#LONG} entries
 * @param mediumTtl Time-to-live of {@link TtlClass#MEDIUM} entries
 * @param purgeInterval Period of the background expiry sweep; zero disables it
 */
public record CacheConfig(
    boolean enabled,
    int maxEntries,
    Duration longTtl,
    Duration mediumTtl,
    Duration purgeInterval
) {
    public static final int DEFAULT_MAX_ENTRIES = 1000;
    public static final Duration DEFAULT_PURGE_INTERVAL = Duration.ofMinutes(5);

    public CacheConfig {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
        if (longTtl == null || longTtl.isNegative() || longTtl.isZero()) {
            throw new IllegalArgumentException("longTtl must be > 0");
        }
        if (mediumTtl == null || mediumTtl.isNegative() || mediumTtl.isZero()) {
            throw new IllegalArgumentException("mediumTtl must be > 0");
        }
        if (purgeInterval == null || purgeInterval.isNegative()) {
            throw new IllegalArgumentException("purgeInterval must be >= 0");
        }
    }

    public static CacheConfig defaults() {
        return ofMaxEntries(DEFAULT_MAX_ENTRIES);
    }

    public static CacheConfig ofMaxEntries(int maxEntries) {
        return new CacheConfig(
            true,
            maxEntries,
            TtlClass.LONG.defaultTtl(),
            TtlClass.MEDIUM.defaultTtl(),
            DEFAULT_PURGE_INTERVAL
        );
    }

    public static CacheConfig disabled() {
        return defaults().withEnabled(false);
    }

    public CacheConfig withEnabled(boolean on) {
        return new CacheConfig(on, maxEntries, longTtl, mediumTtl, purgeInterval);
    }

    /**
     * @return the configured time-to-live, or null for {@link TtlClass#PERMANENT}
     */
    public Duration ttlFor(TtlClass ttlClass) {
        return switch (ttlClass) {
            case PERMANENT -> null;
            case LONG -> longTtl;
            case MEDIUM -> mediumTtl;
            case NONE -> Duration.ZERO;
        };
    }
}
