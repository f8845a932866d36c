package sm.core.error;

public final class TransportFailureException extends FetchException {

    public TransportFailureException(String message, Throwable cause) {
        super(Kind.TRANSPORT_FAILURE, message, cause);
    }
}
