package sm.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic clock for tests. Parking advances virtual time instead of sleeping,
 * so admission waits of minutes or days complete instantly.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    @Override
    public long wallMillis() {
        return now.get() / 1_000_000L;
    }

    @Override
    public boolean park(long nanos, CancellationToken token) {
        if (token.isCancelled()) {
            return true;
        }
        if (nanos > 0) {
            now.addAndGet(nanos);
        }
        return token.isCancelled();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceSeconds(long seconds) {
        advanceNanos(seconds * 1_000_000_000L);
    }

    public void setNanos(long value) {
        now.set(value);
    }
}
