package sm.core.error;

import java.time.Duration;
import java.util.Optional;

public final class QuotaExhaustedException extends FetchException {

    private final Duration retryAfter;

    public QuotaExhaustedException(String message, Duration retryAfter) {
        this(message, retryAfter, null);
    }

    public QuotaExhaustedException(String message, Duration retryAfter, Throwable cause) {
        super(Kind.QUOTA_EXHAUSTED, message, cause);
        this.retryAfter = retryAfter;
    }

    @Override
    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
