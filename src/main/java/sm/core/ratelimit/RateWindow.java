package sm.core.ratelimit;

import sm.core.model.WindowKind;

import java.util.ArrayDeque;

/**
 * Exact sliding window (log): keeps the timestamp of every admitted call.
 *
 * Pros: no boundary bursts, exact "never exceed" guarantee.
 * Cons: O(limit) memory; fine for API plan sizes.
 *
 * Besides real calls, the window can be saturated until a given instant: it then
 * reports itself full regardless of the log, which is how an upstream quota
 * rejection forces local callers to wait.
 *
 * Thread-safety: none. The owning limiter serializes access.
 */
public final class RateWindow {
    private final WindowKind kind;
    private final long windowNanos;
    private final int limit;

    private final ArrayDeque<Long> events = new ArrayDeque<>();
    private long saturatedUntilNanos = Long.MIN_VALUE;

    public RateWindow(WindowKind kind, int limit) {
        this(kind, kind.spanNanos(), limit);
    }

    RateWindow(WindowKind kind, long windowNanos, int limit) {
        if (kind == null) throw new IllegalArgumentException("kind cannot be null");
        if (windowNanos <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.kind = kind;
        this.windowNanos = windowNanos;
        this.limit = limit;
    }

    public WindowKind kind() {
        return kind;
    }

    public int limit() {
        return limit;
    }

    /**
     * Calls counted against this window at {@code now}; equals {@link #limit()} while saturated.
     */
    public int occupied(long now) {
        prune(now);
        if (isSaturated(now)) {
            return limit;
        }
        return events.size();
    }

    public int remaining(long now) {
        return Math.max(0, limit - occupied(now));
    }

    public boolean hasCapacity(long now) {
        return occupied(now) < limit;
    }

    /**
     * Records one admitted call. Callers must check {@link #hasCapacity(long)} first.
     */
    public void reserve(long now) {
        if (!hasCapacity(now)) {
            throw new IllegalStateException(kind + " window full: limit " + limit);
        }
        events.addLast(now);
    }

    /**
     * Time until one more call fits, or 0 if it fits now.
     */
    public long nanosUntilFree(long now) {
        prune(now);
        long wait = 0L;
        if (isSaturated(now)) {
            wait = saturatedUntilNanos - now;
        }
        if (events.size() >= limit) {
            // the slot frees when enough old calls age out to bring the count below limit
            int excess = events.size() - limit;
            long releasing = nthOldest(excess);
            wait = Math.max(wait, (releasing + windowNanos) - now);
        }
        return Math.max(0L, wait);
    }

    /**
     * Instant at which the current log would naturally drain its oldest call,
     * or one full window from now when the log is empty.
     */
    public long naturalReleaseNanos(long now) {
        prune(now);
        Long oldest = events.peekFirst();
        return oldest == null ? now + windowNanos : oldest + windowNanos;
    }

    /**
     * Forces the window to report itself full until {@code untilNanos}. Never shortens
     * an existing saturation.
     */
    public void saturateUntil(long untilNanos) {
        saturatedUntilNanos = Math.max(saturatedUntilNanos, untilNanos);
    }

    private boolean isSaturated(long now) {
        return now < saturatedUntilNanos;
    }

    private long nthOldest(int n) {
        int i = 0;
        for (Long t : events) {
            if (i++ == n) return t;
        }
        throw new IllegalStateException("log shorter than " + (n + 1));
    }

    private void prune(long now) {
        long cutoff = now - windowNanos;
        while (!events.isEmpty() && events.peekFirst() <= cutoff) {
            events.removeFirst();
        }
    }
}
