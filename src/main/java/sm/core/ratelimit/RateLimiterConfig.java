package sm.core.ratelimit;

import java.time.Duration;

/**
 * Configuration for the upstream quota limiter.
 *
 * @param callsPerMinute Maximum upstream calls in any 60 second span
 * @param callsPerDay Maximum upstream calls in any 24 hour span
 * @param baseBackoff First delay after an upstream quota rejection without retry-after
 * @param maxBackoff Cap for the exponential backoff
 * @param maxWait Longest admission wait worth suspending for; a day window that frees
 *                later than this rejects instead
 * @param jitterRatio Fraction of each backoff step added as random jitter, in [0, 1]
 */
public record RateLimiterConfig(
    int callsPerMinute,
    int callsPerDay,
    Duration baseBackoff,
    Duration maxBackoff,
    Duration maxWait,
    double jitterRatio
) {
    public static final Duration DEFAULT_BASE_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(90);
    public static final double DEFAULT_JITTER = 0.2;

    public RateLimiterConfig {
        if (callsPerMinute <= 0) throw new IllegalArgumentException("callsPerMinute must be > 0");
        if (callsPerDay <= 0) throw new IllegalArgumentException("callsPerDay must be > 0");
        if (baseBackoff == null || baseBackoff.isNegative() || baseBackoff.isZero()) {
            throw new IllegalArgumentException("baseBackoff must be > 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0");
        }
        if (jitterRatio < 0 || jitterRatio > 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1]");
        }
    }

    /**
     * Creates a configuration with default backoff and wait settings.
     *
     * @param callsPerMinute Per-minute ceiling
     * @param callsPerDay Per-day ceiling
     * @return Configuration for the quota limiter
     */
    public static RateLimiterConfig of(int callsPerMinute, int callsPerDay) {
        return new RateLimiterConfig(
            callsPerMinute,
            callsPerDay,
            DEFAULT_BASE_BACKOFF,
            DEFAULT_MAX_BACKOFF,
            DEFAULT_MAX_WAIT,
            DEFAULT_JITTER
        );
    }

    public RateLimiterConfig withBackoff(Duration base, Duration max) {
        return new RateLimiterConfig(callsPerMinute, callsPerDay, base, max, maxWait, jitterRatio);
    }

    public RateLimiterConfig withMaxWait(Duration wait) {
        return new RateLimiterConfig(callsPerMinute, callsPerDay, baseBackoff, maxBackoff, wait, jitterRatio);
    }

    public RateLimiterConfig withJitter(double ratio) {
        return new RateLimiterConfig(callsPerMinute, callsPerDay, baseBackoff, maxBackoff, maxWait, ratio);
    }
}
