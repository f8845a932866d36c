package sm.core.upstream;

import sm.core.model.WindowKind;

import java.time.Duration;
import java.util.Optional;

/**
 * Upstream refused the call for quota reasons despite local admission.
 */
public final class QuotaRejectedException extends UpstreamException {

    private final Duration retryAfter;
    private final WindowKind window;

    public QuotaRejectedException(String message, Duration retryAfter, WindowKind window) {
        super(message, null);
        this.retryAfter = retryAfter;
        this.window = window == null ? WindowKind.MINUTE : window;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    public WindowKind window() {
        return window;
    }
}
