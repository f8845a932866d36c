package sm.core.model;

import java.time.Duration;

/**
 * Pure core contract: no I/O, no threads.
 * A single instance guards the one upstream credential for the whole process.
 */
public interface RateLimiter {

    /**
     * Decides whether one upstream call may go out now. An ADMIT reserves the slot,
     * so the caller must make (at most) one upstream call per ADMIT.
     */
    AdmissionDecision acquire();

    /**
     * Feeds the upstream verdict back into the limiter.
     *
     * @param success false only for quota rejections reported by the upstream
     * @param retryAfterHint upstream retry-after, or null when the upstream gave none
     */
    void recordOutcome(boolean success, Duration retryAfterHint);

    /**
     * Same as {@link #recordOutcome(boolean, Duration)}, naming the window the upstream
     * reported as exhausted. Limiters without per-window bookkeeping ignore it.
     */
    default void recordOutcome(boolean success, Duration retryAfterHint, WindowKind affected) {
        recordOutcome(success, retryAfterHint);
    }
}
