package sm.core.model;

import java.util.concurrent.TimeUnit;

/**
 * Quota windows enforced against the upstream.
 *
 * Both are sliding windows over a timestamp log:
 * - MINUTE: short burst ceiling, frees continuously
 * - DAY: plan budget, the one that can make a call impossible within a bounded wait
 */
public enum WindowKind {
    MINUTE(TimeUnit.MINUTES.toNanos(1)),
    DAY(TimeUnit.DAYS.toNanos(1));

    private final long spanNanos;

    WindowKind(long spanNanos) {
        this.spanNanos = spanNanos;
    }

    public long spanNanos() {
        return spanNanos;
    }
}
