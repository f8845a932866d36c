package sm.core.clock;

import java.util.concurrent.TimeUnit;

/**
 * Time source for every time-dependent decision (window aging, TTL expiry, backoff).
 *
 * <p>{@link #nowNanos()} is monotonic and drives all arithmetic. {@link #wallMillis()}
 * is only used for reporting (when an entry was stored).
 */
public interface Clock {

    long nowNanos();

    long wallMillis();

    /**
     * Blocks for up to {@code nanos}, returning early when {@code token} is cancelled.
     *
     * @return true if the wait ended because the token was cancelled
     */
    default boolean park(long nanos, CancellationToken token) throws InterruptedException {
        if (nanos <= 0) {
            return token.isCancelled();
        }
        return token.await(nanos, TimeUnit.NANOSECONDS);
    }
}
