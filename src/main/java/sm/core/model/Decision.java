package sm.core.model;

/**
 * Outcome kinds of an admission request against the upstream quota.
 */
public enum Decision {
    /** Call may go upstream now; a slot has been reserved. */
    ADMIT,
    /** No capacity now; capacity frees after {@link AdmissionDecision#waitNanos()}. */
    WAIT,
    /** No capacity within the allowed wait ceiling. */
    REJECT
}
