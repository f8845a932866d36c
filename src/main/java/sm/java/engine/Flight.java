package sm.java.engine;

import com.fasterxml.jackson.databind.JsonNode;
import sm.core.clock.CancellationToken;
import sm.core.model.QueryFingerprint;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One upstream fetch shared by every concurrent caller of the same fingerprint.
 *
 * <p>Callers never hold the shared future itself, only a dependent copy, so a caller
 * cancelling its copy leaves the others untouched. The flight's token is cancelled
 * only once every caller has walked away.
 */
final class Flight {

    private final QueryFingerprint fingerprint;
    private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
    private final CancellationToken token = new CancellationToken();
    private final AtomicInteger waiters = new AtomicInteger();

    Flight(QueryFingerprint fingerprint) {
        this.fingerprint = fingerprint;
    }

    QueryFingerprint fingerprint() {
        return fingerprint;
    }

    CompletableFuture<JsonNode> result() {
        return result;
    }

    CancellationToken token() {
        return token;
    }

    boolean isAbandoned() {
        return token.isCancelled();
    }

    int waiters() {
        return waiters.get();
    }

    /**
     * Registers one more caller. Must be called while the registry holds the key.
     */
    CompletableFuture<JsonNode> addWaiter() {
        waiters.incrementAndGet();
        return result.copy();
    }

    /**
     * Drops one caller; cancels the flight when it was the last one and the result is
     * not in yet. Must be called while the registry holds the key.
     *
     * @return true if the flight was abandoned by this call
     */
    boolean removeWaiter() {
        if (waiters.decrementAndGet() == 0 && !result.isDone()) {
            token.cancel();
            return true;
        }
        return false;
    }
}
