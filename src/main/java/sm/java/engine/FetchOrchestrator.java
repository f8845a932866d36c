package sm.java.engine;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.cache.QueryCache;
import sm.core.clock.Clock;
import sm.core.error.FetchException;
import sm.core.error.QuotaExhaustedException;
import sm.core.error.TransportFailureException;
import sm.core.error.UpstreamErrorException;
import sm.core.freshness.FreshnessClassifier;
import sm.core.model.AdmissionDecision;
import sm.core.model.CacheEntry;
import sm.core.model.QueryFamily;
import sm.core.model.QueryFingerprint;
import sm.core.model.RateLimiter;
import sm.core.model.TtlClass;
import sm.core.upstream.QuotaRejectedException;
import sm.core.upstream.TransportException;
import sm.core.upstream.UpstreamCall;
import sm.core.upstream.UpstreamException;
import sm.core.upstream.UpstreamRejectedException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point the tool layer calls to get upstream data.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Fingerprint the query and look it up in the {@link QueryCache}. A hit returns
 *       immediately without touching the rate limiter.</li>
 *   <li>On a miss, join the in-flight fetch for the fingerprint, or lead a new one.
 *       Only the leader's flight ever calls upstream.</li>
 *   <li>The flight waits for admission from the {@link RateLimiter}, bounded by the
 *       admission timeout and attempt count, then calls upstream.</li>
 *   <li>Transport failures are retried with doubling delay; each retry is admitted
 *       again. Quota and upstream rejections are surfaced at once.</li>
 *   <li>The result is classified by {@link FreshnessClassifier}, stored, and handed to
 *       every caller of the flight.</li>
 * </ol>
 *
 * <p>Thread-safety: safe for concurrent use. Flights run on the injected executor; the
 * orchestrator does not own it.
 */
public final class FetchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FetchOrchestrator.class);

    private final Clock clock;
    private final RateLimiter limiter;
    private final QueryCache cache;
    private final OrchestratorConfig config;
    private final Executor executor;
    private final InFlightRegistry inFlight = new InFlightRegistry();

    /**
     * @param clock Clock used for admission deadlines and waits
     * @param limiter The process-wide upstream quota limiter
     * @param cache Query cache; when disabled, lookups and stores are skipped
     * @param config Retry and timeout settings
     * @param executor Runs flights
     */
    public FetchOrchestrator(
        Clock clock,
        RateLimiter limiter,
        QueryCache cache,
        OrchestratorConfig config,
        Executor executor
    ) {
        if (clock == null) throw new IllegalArgumentException("clock cannot be null");
        if (limiter == null) throw new IllegalArgumentException("limiter cannot be null");
        if (cache == null) throw new IllegalArgumentException("cache cannot be null");
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (executor == null) throw new IllegalArgumentException("executor cannot be null");
        this.clock = clock;
        this.limiter = limiter;
        this.cache = cache;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Fetches a query, blocking until the shared result is available.
     *
     * @param family Query family
     * @param parameters Query parameters; blank values are ignored
     * @param upstreamCall Capability that performs the network call
     * @return The upstream payload, possibly served from cache
     * @throws FetchException typed failure; see {@link FetchException.Kind}
     */
    public JsonNode fetch(QueryFamily family, Map<String, String> parameters, UpstreamCall upstreamCall)
        throws FetchException {
        CompletableFuture<JsonNode> waiter = fetchAsync(family, parameters, upstreamCall);
        try {
            return waiter.get(config.fetchTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (TimeoutException e) {
            waiter.cancel(false);
            throw new TransportFailureException("no result for " + family.wireName()
                + " within " + config.fetchTimeout(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            waiter.cancel(false);
            throw new TransportFailureException("interrupted while waiting for " + family.wireName(), e);
        }
    }

    /**
     * Non-blocking variant. Cancelling the returned future abandons this caller only;
     * the upstream call is skipped only when every caller of the same query abandons
     * it before admission.
     *
     * <p>The future fails with a {@link FetchException} for every typed failure.
     */
    public CompletableFuture<JsonNode> fetchAsync(
        QueryFamily family,
        Map<String, String> parameters,
        UpstreamCall upstreamCall
    ) {
        if (family == null) throw new IllegalArgumentException("family cannot be null");
        if (upstreamCall == null) throw new IllegalArgumentException("upstreamCall cannot be null");

        QueryFingerprint fingerprint = QueryFingerprint.of(family, parameters);

        if (cache.isEnabled()) {
            try {
                Optional<CacheEntry> hit = cache.lookup(fingerprint);
                if (hit.isPresent()) {
                    return CompletableFuture.completedFuture(hit.get().payload());
                }
            } catch (FetchException e) {
                return CompletableFuture.failedFuture(e);
            }
        }

        InFlightRegistry.Joined joined = inFlight.join(fingerprint);
        if (joined.leader()) {
            Map<String, String> normalized = QueryFingerprint.normalize(parameters);
            Flight flight = joined.flight();
            log.debug("FETCH_LEAD fingerprint={}", fingerprint);
            try {
                executor.execute(() -> run(flight, family, normalized, upstreamCall));
            } catch (RejectedExecutionException e) {
                inFlight.complete(flight);
                flight.result().completeExceptionally(
                    new TransportFailureException("fetch executor rejected " + fingerprint, e));
            }
        } else {
            log.debug("FETCH_JOIN fingerprint={} waiters={}", fingerprint, joined.flight().waiters());
        }
        return joined.waiter();
    }

    /**
     * Number of distinct queries currently being fetched upstream.
     */
    public int inFlightCount() {
        return inFlight.size();
    }

    public QueryCache cache() {
        return cache;
    }

    private void run(Flight flight, QueryFamily family, Map<String, String> parameters, UpstreamCall upstreamCall) {
        QueryFingerprint fingerprint = flight.fingerprint();
        try {
            // A previous flight may have stored the entry between the caller's miss and the join.
            Optional<CacheEntry> stored = cache.isEnabled() ? cache.peek(fingerprint) : Optional.empty();
            if (stored.isPresent()) {
                log.debug("FETCH_DONE fingerprint={} fromCache=true waiters={}", fingerprint, flight.waiters());
                inFlight.complete(flight);
                flight.result().complete(stored.get().payload());
                return;
            }

            JsonNode payload = fetchUpstream(flight, family, parameters, upstreamCall);
            TtlClass ttlClass = FreshnessClassifier.classify(family, parameters, payload);
            if (cache.isEnabled()) {
                cache.store(fingerprint, payload, ttlClass);
            }
            log.info("FETCH_DONE fingerprint={} ttlClass={} waiters={}", fingerprint, ttlClass, flight.waiters());
            inFlight.complete(flight);
            flight.result().complete(payload);
        } catch (FetchException e) {
            log.info("FETCH_FAILED fingerprint={} kind={} message={}", fingerprint, e.kind(), e.getMessage());
            inFlight.complete(flight);
            flight.result().completeExceptionally(e);
        } catch (CancellationException e) {
            log.info("FETCH_ABANDONED fingerprint={}", fingerprint);
            inFlight.complete(flight);
            flight.result().completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("FETCH_ERROR fingerprint={}", fingerprint, e);
            inFlight.complete(flight);
            flight.result().completeExceptionally(e);
        }
    }

    private JsonNode fetchUpstream(
        Flight flight,
        QueryFamily family,
        Map<String, String> parameters,
        UpstreamCall upstreamCall
    ) throws FetchException {
        long deadline = clock.nowNanos() + config.admissionTimeout().toNanos();
        long retryDelay = config.transportRetryDelay().toNanos();

        for (int attempt = 1; ; attempt++) {
            awaitAdmission(flight, deadline);
            try {
                JsonNode payload = upstreamCall.call(family, parameters);
                limiter.recordOutcome(true, null);
                return payload;
            } catch (QuotaRejectedException e) {
                Duration hint = e.retryAfter().orElse(null);
                limiter.recordOutcome(false, hint, e.window());
                throw new QuotaExhaustedException(
                    "upstream quota rejection (" + e.window() + "): " + e.getMessage(), hint, e);
            } catch (UpstreamRejectedException e) {
                limiter.recordOutcome(true, null);
                throw new UpstreamErrorException(e.getMessage(), e);
            } catch (TransportException e) {
                if (attempt >= config.transportMaxAttempts()) {
                    throw new TransportFailureException(
                        "upstream unreachable after " + attempt + " attempt(s): " + e.getMessage(), e);
                }
                log.warn("TRANSPORT_RETRY fingerprint={} attempt={} delayMs={} error={}",
                    flight.fingerprint(), attempt, TimeUnit.NANOSECONDS.toMillis(retryDelay), e.getMessage());
                parkBetweenAttempts(flight, retryDelay, e);
                retryDelay = retryDelay * 2;
            } catch (UpstreamException e) {
                throw new TransportFailureException("upstream call failed: " + e.getMessage(), e);
            } catch (RuntimeException e) {
                throw new TransportFailureException("upstream call failed unexpectedly: " + e, e);
            }
        }
    }

    private void awaitAdmission(Flight flight, long deadline) throws QuotaExhaustedException {
        for (int attempt = 1; ; attempt++) {
            if (flight.isAbandoned()) {
                throw new CancellationException("all callers abandoned " + flight.fingerprint());
            }

            AdmissionDecision decision = limiter.acquire();
            switch (decision.decision()) {
                case ADMIT:
                    return;
                case REJECT:
                    throw new QuotaExhaustedException(decision.reason(), decision.waitDuration());
                case WAIT:
                default:
                    break;
            }

            long now = clock.nowNanos();
            if (attempt >= config.maxAdmissionAttempts() || now + decision.waitNanos() > deadline) {
                throw new QuotaExhaustedException(
                    "rate limited: no admission within " + config.admissionTimeout(), decision.waitDuration());
            }

            log.info("ADMISSION_WAIT fingerprint={} waitMs={} attempt={}",
                flight.fingerprint(), TimeUnit.NANOSECONDS.toMillis(decision.waitNanos()), attempt);
            try {
                if (clock.park(decision.waitNanos(), flight.token())) {
                    throw new CancellationException("all callers abandoned " + flight.fingerprint());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QuotaExhaustedException("interrupted while waiting for admission", decision.waitDuration(), e);
            }
        }
    }

    private void parkBetweenAttempts(Flight flight, long delayNanos, TransportException last)
        throws TransportFailureException {
        try {
            if (clock.park(delayNanos, flight.token())) {
                throw new CancellationException("all callers abandoned " + flight.fingerprint());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            TransportFailureException failure = new TransportFailureException("interrupted between retries", e);
            failure.addSuppressed(last);
            throw failure;
        }
    }

    private static FetchException unwrap(Throwable cause) {
        if (cause instanceof FetchException) {
            return (FetchException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new TransportFailureException("fetch failed: " + cause, cause);
    }
}
