package sm.core.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Typed failure surfaced by a fetch. Callers switch on {@link #kind()} to tell
 * "try again later" from "this query is invalid".
 */
public abstract class FetchException extends Exception {

    public enum Kind {
        /** No admission possible within the wait ceiling, or upstream confirmed the quota is spent. */
        QUOTA_EXHAUSTED,
        /** Network or parse failure that survived the local retries. */
        TRANSPORT_FAILURE,
        /** Well-formed upstream rejection unrelated to quota. */
        UPSTREAM_ERROR,
        /** A defect, such as a fingerprint collision. */
        INVARIANT_VIOLATION
    }

    private final Kind kind;

    protected FetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * True when the same query may succeed later without changes.
     */
    public boolean isRetryable() {
        return kind == Kind.QUOTA_EXHAUSTED || kind == Kind.TRANSPORT_FAILURE;
    }

    /**
     * Earliest point worth retrying, when known.
     */
    public Optional<Duration> retryAfter() {
        return Optional.empty();
    }
}
