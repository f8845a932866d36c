package sm.core.upstream;

/**
 * Well-formed rejection unrelated to quota, e.g. invalid parameters echoed back.
 * Never retried.
 */
public final class UpstreamRejectedException extends UpstreamException {

    private final int status;

    public UpstreamRejectedException(String message, int status) {
        super(message, null);
        this.status = status;
    }

    public int status() {
        return status;
    }
}
