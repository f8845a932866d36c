package sm.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable cached upstream result. Entries are replaced, never updated.
 *
 * @param fingerprint key the entry was stored under
 * @param payload upstream result; treated as read-only by every reader
 * @param ttlClass freshness class the entry was stored with
 * @param storedAtNanos monotonic store time
 * @param storedAtMillis wall-clock store time, for reporting
 * @param expiresAtNanos monotonic expiry, or {@link #NEVER}
 */
public record CacheEntry(
    QueryFingerprint fingerprint,
    JsonNode payload,
    TtlClass ttlClass,
    long storedAtNanos,
    long storedAtMillis,
    long expiresAtNanos
) {
    public static final long NEVER = Long.MAX_VALUE;

    public boolean isPermanent() {
        return expiresAtNanos == NEVER;
    }

    public boolean isExpired(long nowNanos) {
        return expiresAtNanos != NEVER && nowNanos >= expiresAtNanos;
    }
}
