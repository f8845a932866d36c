package sm.java.engine;

import com.fasterxml.jackson.databind.JsonNode;
import sm.core.model.QueryFingerprint;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fingerprint-keyed registry of in-flight upstream fetches.
 *
 * <p>Joining and leaving both run inside {@code ConcurrentMap.compute} on the key, so
 * a caller can never join a flight in the instant it is being abandoned: an abandoned
 * flight is replaced by a fresh one.
 *
 * <p>Size does not grow beyond the number of distinct queries in flight.
 */
final class InFlightRegistry {

    private final ConcurrentMap<QueryFingerprint, Flight> flights = new ConcurrentHashMap<>();

    /**
     * Result of joining: the flight, whether the caller must run it, and the caller's
     * own future.
     */
    record Joined(Flight flight, boolean leader, CompletableFuture<JsonNode> waiter) {
    }

    Joined join(QueryFingerprint fingerprint) {
        AtomicBoolean leader = new AtomicBoolean();
        AtomicReference<CompletableFuture<JsonNode>> waiter = new AtomicReference<>();

        Flight flight = flights.compute(fingerprint, (k, existing) -> {
            Flight f = existing;
            if (f == null || f.isAbandoned()) {
                f = new Flight(k);
                leader.set(true);
            }
            waiter.set(f.addWaiter());
            return f;
        });

        CompletableFuture<JsonNode> own = waiter.get();
        own.whenComplete((value, error) -> {
            if (own.isCancelled()) {
                leave(flight);
            }
        });
        return new Joined(flight, leader.get(), own);
    }

    /**
     * Removes a finished flight. No-op when a newer flight already took its place.
     */
    void complete(Flight flight) {
        flights.remove(flight.fingerprint(), flight);
    }

    int size() {
        return flights.size();
    }

    private void leave(Flight flight) {
        flights.compute(flight.fingerprint(), (k, current) -> {
            boolean abandoned = flight.removeWaiter();
            if (abandoned && current == flight) {
                return null;
            }
            return current;
        });
    }
}
