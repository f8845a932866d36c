package sm.core.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.clock.Clock;
import sm.core.model.AdmissionDecision;
import sm.core.model.RateLimiter;
import sm.core.model.WindowKind;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Two-window quota limiter guarding the single upstream credential.
 *
 * <p>Admission:
 * <ol>
 *   <li>Age out calls older than each window.</li>
 *   <li>If both windows have room and no backoff is active, reserve a slot in both: ADMIT.</li>
 *   <li>If the day window frees later than {@code maxWait}: REJECT.</li>
 *   <li>Otherwise WAIT until the latest of the windows and the backoff floor frees.</li>
 * </ol>
 *
 * <p>Upstream quota rejections saturate the affected window and arm a backoff floor:
 * the retry-after hint verbatim when given, exponential backoff with jitter otherwise.
 *
 * <p>Thread-safety: one ReentrantLock serializes every read-modify-write of the windows,
 * so two callers can never both take the last slot. Reservations are final: a slot
 * spent on a call that later fails at the transport level is not returned.
 */
public final class QuotaRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(QuotaRateLimiter.class);

    private final Clock clock;
    private final RateLimiterConfig config;
    private final RateWindow minute;
    private final RateWindow day;
    private final BackoffPolicy backoff;
    private final ReentrantLock lock = new ReentrantLock();

    private int consecutiveRejections;
    private long backoffUntilNanos = Long.MIN_VALUE;

    public QuotaRateLimiter(Clock clock, RateLimiterConfig config) {
        this(clock, config, new BackoffPolicy(
            config.baseBackoff().toNanos(),
            config.maxBackoff().toNanos(),
            config.jitterRatio()
        ));
    }

    public QuotaRateLimiter(Clock clock, RateLimiterConfig config, BackoffPolicy backoff) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (backoff == null) throw new IllegalArgumentException("backoff cannot be null");
        this.clock = clock;
        this.config = config;
        this.minute = new RateWindow(WindowKind.MINUTE, config.callsPerMinute());
        this.day = new RateWindow(WindowKind.DAY, config.callsPerDay());
        this.backoff = backoff;
    }

    @Override
    public AdmissionDecision acquire() {
        lock.lock();
        try {
            long now = clock.nowNanos();

            long dayWait = day.nanosUntilFree(now);
            if (dayWait > config.maxWait().toNanos()) {
                log.warn("RATE_REJECT window=DAY freesInMs={}", TimeUnit.NANOSECONDS.toMillis(dayWait));
                return AdmissionDecision.reject("daily quota exhausted", dayWait);
            }

            long wait = Math.max(dayWait, minute.nanosUntilFree(now));
            if (backoffUntilNanos > now) {
                wait = Math.max(wait, backoffUntilNanos - now);
            }

            if (wait == 0L) {
                minute.reserve(now);
                day.reserve(now);
                log.debug("RATE_ADMIT minuteRemaining={} dayRemaining={}",
                    minute.remaining(now), day.remaining(now));
                return AdmissionDecision.admit();
            }

            log.debug("RATE_WAIT waitMs={}", TimeUnit.NANOSECONDS.toMillis(wait));
            return AdmissionDecision.waitFor(wait);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordOutcome(boolean success, Duration retryAfterHint) {
        recordOutcome(success, retryAfterHint, WindowKind.MINUTE);
    }

    @Override
    public void recordOutcome(boolean success, Duration retryAfterHint, WindowKind affected) {
        if (affected == null) throw new IllegalArgumentException("affected cannot be null");
        lock.lock();
        try {
            if (success) {
                if (consecutiveRejections > 0) {
                    log.info("QUOTA_RECOVERED afterRejections={}", consecutiveRejections);
                }
                consecutiveRejections = 0;
                backoff.reset();
                return;
            }

            long now = clock.nowNanos();
            consecutiveRejections++;
            long delay = retryAfterHint != null
                ? Math.max(0L, retryAfterHint.toNanos())
                : backoff.nextDelayNanos();
            long until = now + delay;
            backoffUntilNanos = Math.max(backoffUntilNanos, until);

            if (affected == WindowKind.DAY && retryAfterHint == null) {
                day.saturateUntil(day.naturalReleaseNanos(now));
            } else {
                window(affected).saturateUntil(until);
            }

            log.warn("QUOTA_REJECTED window={} retryAfterMs={} hinted={} consecutive={}",
                affected, TimeUnit.NANOSECONDS.toMillis(delay), retryAfterHint != null, consecutiveRejections);
        } finally {
            lock.unlock();
        }
    }

    public QuotaSnapshot snapshot() {
        lock.lock();
        try {
            long now = clock.nowNanos();
            return new QuotaSnapshot(
                minute.remaining(now),
                minute.limit(),
                day.remaining(now),
                day.limit(),
                consecutiveRejections,
                backoffUntilNanos > now ? backoffUntilNanos - now : 0L
            );
        } finally {
            lock.unlock();
        }
    }

    public RateLimiterConfig config() {
        return config;
    }

    private RateWindow window(WindowKind kind) {
        return kind == WindowKind.DAY ? day : minute;
    }
}
