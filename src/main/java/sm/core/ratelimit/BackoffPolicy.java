package sm.core.ratelimit;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff for consecutive upstream quota rejections.
 *
 * delay(n) = min(max, base * 2^(n-1) + jitter), jitter uniform in [0, ratio * base * 2^(n-1)).
 * Delays never decrease between resets, so jitter cannot make a later retry come sooner.
 *
 * Thread-safety: none. The owning limiter serializes access.
 */
public final class BackoffPolicy {
    private final long baseNanos;
    private final long maxNanos;
    private final double jitterRatio;
    private final DoubleSupplier random;

    private int attempts;
    private long lastDelayNanos;

    public BackoffPolicy(long baseNanos, long maxNanos, double jitterRatio) {
        this(baseNanos, maxNanos, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(long baseNanos, long maxNanos, double jitterRatio, DoubleSupplier random) {
        if (baseNanos <= 0) throw new IllegalArgumentException("base <= 0");
        if (maxNanos < baseNanos) throw new IllegalArgumentException("max < base");
        if (jitterRatio < 0 || jitterRatio > 1) throw new IllegalArgumentException("jitter not in [0, 1]");
        if (random == null) throw new IllegalArgumentException("random cannot be null");
        this.baseNanos = baseNanos;
        this.maxNanos = maxNanos;
        this.jitterRatio = jitterRatio;
        this.random = random;
    }

    public long nextDelayNanos() {
        attempts++;
        long exponential = exponential(attempts);
        long jitter = (long) (exponential * jitterRatio * random.getAsDouble());
        long delay = Math.min(maxNanos, saturatedAdd(exponential, jitter));
        delay = Math.max(delay, lastDelayNanos);
        lastDelayNanos = delay;
        return delay;
    }

    public void reset() {
        attempts = 0;
        lastDelayNanos = 0L;
    }

    public int attempts() {
        return attempts;
    }

    private long exponential(int attempt) {
        int shift = Math.min(attempt - 1, 62);
        if (baseNanos > (maxNanos >> shift)) {
            return maxNanos;
        }
        return Math.min(maxNanos, baseNanos << shift);
    }

    private static long saturatedAdd(long a, long b) {
        long r = a + b;
        return r < 0 ? Long.MAX_VALUE : r;
    }
}
