package sm.core.model;

import java.time.Duration;

public record AdmissionDecision(
    Decision decision,
    long waitNanos,
    String reason
) {
    private static final AdmissionDecision ADMIT = new AdmissionDecision(Decision.ADMIT, 0L, null);

    public static AdmissionDecision admit() {
        return ADMIT;
    }

    public static AdmissionDecision waitFor(long waitNanos) {
        return new AdmissionDecision(Decision.WAIT, Math.max(1L, waitNanos), null);
    }

    public static AdmissionDecision reject(String reason, long retryAfterNanos) {
        return new AdmissionDecision(Decision.REJECT, Math.max(0L, retryAfterNanos), reason);
    }

    public boolean admitted() {
        return decision == Decision.ADMIT;
    }

    public Duration waitDuration() {
        return Duration.ofNanos(waitNanos);
    }
}
