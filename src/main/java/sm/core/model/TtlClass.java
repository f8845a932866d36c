package sm.core.model;

import java.time.Duration;

/**
 * Freshness policy of a cached result, chosen from the volatility of the data.
 */
public enum TtlClass {
    /** Completed events: the record will never change. */
    PERMANENT(null),
    /** Reference data such as teams, venues and leagues. */
    LONG(Duration.ofHours(24)),
    /** Scheduled events and aggregate statistics. */
    MEDIUM(Duration.ofHours(1)),
    /** Live data: never cached. */
    NONE(Duration.ZERO);

    private final Duration defaultTtl;

    TtlClass(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    /**
     * @return the default time-to-live, or null for {@link #PERMANENT}
     */
    public Duration defaultTtl() {
        return defaultTtl;
    }

    public boolean cacheable() {
        return this != NONE;
    }
}
