package sm.core.error;

public final class UpstreamErrorException extends FetchException {

    public UpstreamErrorException(String message, Throwable cause) {
        super(Kind.UPSTREAM_ERROR, message, cause);
    }
}
