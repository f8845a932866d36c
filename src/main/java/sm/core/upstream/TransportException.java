package sm.core.upstream;

/**
 * Transient failure: network error, server error or a body that could not be parsed.
 * Worth retrying locally.
 */
public final class TransportException extends UpstreamException {

    public TransportException(String message) {
        super(message, null);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
