package sm.core.error;

public final class InvariantViolationException extends FetchException {

    public InvariantViolationException(String message) {
        super(Kind.INVARIANT_VIOLATION, message, null);
    }
}
