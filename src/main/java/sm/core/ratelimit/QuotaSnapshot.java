package sm.core.ratelimit;

/**
 * Point-in-time view of the remaining upstream budget.
 */
public record QuotaSnapshot(
    int minuteRemaining,
    int minuteLimit,
    int dayRemaining,
    int dayLimit,
    int consecutiveRejections,
    long backoffRemainingNanos
) {
}
