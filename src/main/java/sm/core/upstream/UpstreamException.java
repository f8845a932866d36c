package sm.core.upstream;

/**
 * Failure signalled by an {@link UpstreamCall}. The orchestrator translates these into
 * the caller-facing {@link sm.core.error.FetchException} taxonomy.
 */
public abstract class UpstreamException extends Exception {

    protected UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
