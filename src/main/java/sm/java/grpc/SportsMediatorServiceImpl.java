package sm.java.grpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.cache.CacheStats;
import sm.core.cache.QueryCache;
import sm.core.error.FetchException;
import sm.core.model.QueryFamily;
import sm.core.ratelimit.QuotaRateLimiter;
import sm.core.ratelimit.QuotaSnapshot;
import sm.java.tools.ArgumentSpec;
import sm.java.tools.SportsTool;
import sm.java.tools.ToolRegistry;
import sm.proto.CacheStatsRequest;
import sm.proto.CacheStatsResponse;
import sm.proto.CallToolRequest;
import sm.proto.CallToolResponse;
import sm.proto.HealthCheckRequest;
import sm.proto.HealthCheckResponse;
import sm.proto.InvalidateCacheRequest;
import sm.proto.InvalidateCacheResponse;
import sm.proto.ListToolsRequest;
import sm.proto.ListToolsResponse;
import sm.proto.QuotaStatusRequest;
import sm.proto.QuotaStatusResponse;
import sm.proto.SportsMediatorServiceGrpc;
import sm.proto.ToolArgument;
import sm.proto.ToolDescriptor;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * gRPC surface over the tool layer plus quota and cache introspection.
 *
 * <p>Failure mapping:
 * <ul>
 *   <li>invalid arguments: INVALID_ARGUMENT</li>
 *   <li>unknown tool: NOT_FOUND</li>
 *   <li>quota exhausted: RESOURCE_EXHAUSTED, with a {@code retry-after-ms} trailer when known</li>
 *   <li>transport failure: UNAVAILABLE</li>
 *   <li>upstream rejection: INVALID_ARGUMENT</li>
 *   <li>invariant violation and anything unexpected: INTERNAL</li>
 * </ul>
 *
 * <p>Thread-safety: stateless; concurrency is handled by the components it wraps.
 */
public final class SportsMediatorServiceImpl extends SportsMediatorServiceGrpc.SportsMediatorServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(SportsMediatorServiceImpl.class);

    static final Metadata.Key<String> RETRY_AFTER_MS =
        Metadata.Key.of("retry-after-ms", Metadata.ASCII_STRING_MARSHALLER);

    private final ToolRegistry tools;
    private final QuotaRateLimiter limiter;
    private final QueryCache cache;
    private final ObjectMapper mapper;

    public SportsMediatorServiceImpl(ToolRegistry tools, QuotaRateLimiter limiter, QueryCache cache, ObjectMapper mapper) {
        if (tools == null) throw new IllegalArgumentException("tools cannot be null");
        if (limiter == null) throw new IllegalArgumentException("limiter cannot be null");
        if (cache == null) throw new IllegalArgumentException("cache cannot be null");
        if (mapper == null) throw new IllegalArgumentException("mapper cannot be null");
        this.tools = tools;
        this.limiter = limiter;
        this.cache = cache;
        this.mapper = mapper;
    }

    @Override
    public void listTools(ListToolsRequest request, StreamObserver<ListToolsResponse> responseObserver) {
        ListToolsResponse.Builder response = ListToolsResponse.newBuilder();
        for (SportsTool tool : tools.all()) {
            ToolDescriptor.Builder descriptor = ToolDescriptor.newBuilder()
                .setName(tool.name())
                .setDescription(tool.description());
            for (ArgumentSpec arg : tool.arguments()) {
                descriptor.addArguments(ToolArgument.newBuilder()
                    .setName(arg.name())
                    .setType(arg.type().name())
                    .setRequired(arg.required())
                    .setDescription(arg.description()));
            }
            response.addTools(descriptor);
        }
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    @Override
    public void callTool(CallToolRequest request, StreamObserver<CallToolResponse> responseObserver) {
        if (request.getTool().isEmpty()) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT.withDescription("tool must not be empty").asRuntimeException());
            return;
        }

        Optional<SportsTool> tool = tools.find(request.getTool());
        if (tool.isEmpty()) {
            responseObserver.onError(
                Status.NOT_FOUND.withDescription("unknown tool: " + request.getTool()).asRuntimeException());
            return;
        }

        try {
            ObjectNode result = tool.get().call(request.getArgumentsMap());
            responseObserver.onNext(CallToolResponse.newBuilder()
                .setResultJson(mapper.writeValueAsString(result))
                .build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT.withDescription(e.getMessage()).withCause(e).asRuntimeException());
        } catch (FetchException e) {
            responseObserver.onError(toStatus(e));
        } catch (JsonProcessingException e) {
            log.error("RESULT_SERIALIZATION_FAILED tool={}", request.getTool(), e);
            responseObserver.onError(
                Status.INTERNAL.withDescription("cannot serialize result").withCause(e).asRuntimeException());
        } catch (Exception e) {
            log.error("CALL_TOOL_ERROR tool={}", request.getTool(), e);
            responseObserver.onError(
                Status.INTERNAL.withDescription("Internal error: " + e.getMessage()).withCause(e).asRuntimeException());
        }
    }

    @Override
    public void getQuotaStatus(QuotaStatusRequest request, StreamObserver<QuotaStatusResponse> responseObserver) {
        QuotaSnapshot snapshot = limiter.snapshot();
        responseObserver.onNext(QuotaStatusResponse.newBuilder()
            .setMinuteRemaining(snapshot.minuteRemaining())
            .setMinuteLimit(snapshot.minuteLimit())
            .setDayRemaining(snapshot.dayRemaining())
            .setDayLimit(snapshot.dayLimit())
            .setConsecutiveRejections(snapshot.consecutiveRejections())
            .setBackoffRemainingMillis(TimeUnit.NANOSECONDS.toMillis(snapshot.backoffRemainingNanos()))
            .build());
        responseObserver.onCompleted();
    }

    @Override
    public void getCacheStats(CacheStatsRequest request, StreamObserver<CacheStatsResponse> responseObserver) {
        CacheStats stats = cache.stats();
        responseObserver.onNext(CacheStatsResponse.newBuilder()
            .setEnabled(stats.enabled())
            .setSize(stats.size())
            .setMaxEntries(stats.maxEntries())
            .setHits(stats.hits())
            .setMisses(stats.misses())
            .setEvictions(stats.evictions())
            .setExpirations(stats.expirations())
            .setHitRate(stats.hitRate())
            .build());
        responseObserver.onCompleted();
    }

    @Override
    public void invalidateCache(InvalidateCacheRequest request, StreamObserver<InvalidateCacheResponse> responseObserver) {
        int removed;
        if (request.getFamily().isEmpty()) {
            removed = cache.clear();
        } else {
            QueryFamily family;
            try {
                family = QueryFamily.fromWireName(request.getFamily());
            } catch (IllegalArgumentException e) {
                responseObserver.onError(
                    Status.INVALID_ARGUMENT.withDescription(e.getMessage()).asRuntimeException());
                return;
            }
            removed = cache.invalidateFamily(family);
        }
        responseObserver.onNext(InvalidateCacheResponse.newBuilder().setRemoved(removed).build());
        responseObserver.onCompleted();
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        responseObserver.onNext(HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .build());
        responseObserver.onCompleted();
    }

    static StatusRuntimeException toStatus(FetchException e) {
        Status status;
        switch (e.kind()) {
            case QUOTA_EXHAUSTED:
                status = Status.RESOURCE_EXHAUSTED;
                break;
            case TRANSPORT_FAILURE:
                status = Status.UNAVAILABLE;
                break;
            case UPSTREAM_ERROR:
                status = Status.INVALID_ARGUMENT;
                break;
            case INVARIANT_VIOLATION:
            default:
                status = Status.INTERNAL;
                break;
        }

        Metadata trailers = new Metadata();
        e.retryAfter().ifPresent(d -> trailers.put(RETRY_AFTER_MS, Long.toString(d.toMillis())));
        return status.withDescription(e.getMessage()).withCause(e).asRuntimeException(trailers);
    }
}
