package sm.java.grpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sm.core.cache.CacheConfig;
import sm.core.cache.QueryCache;
import sm.core.clock.ManualClock;
import sm.core.model.QueryFamily;
import sm.core.model.WindowKind;
import sm.core.ratelimit.QuotaRateLimiter;
import sm.core.ratelimit.RateLimiterConfig;
import sm.core.upstream.QuotaRejectedException;
import sm.core.upstream.TransportException;
import sm.core.upstream.UpstreamCall;
import sm.core.upstream.UpstreamException;
import sm.core.upstream.UpstreamRejectedException;
import sm.java.engine.FetchOrchestrator;
import sm.java.engine.OrchestratorConfig;
import sm.java.tools.ToolRegistry;
import sm.proto.CacheStatsRequest;
import sm.proto.CacheStatsResponse;
import sm.proto.CallToolRequest;
import sm.proto.CallToolResponse;
import sm.proto.HealthCheckRequest;
import sm.proto.HealthCheckResponse;
import sm.proto.InvalidateCacheRequest;
import sm.proto.ListToolsRequest;
import sm.proto.ListToolsResponse;
import sm.proto.QuotaStatusRequest;
import sm.proto.QuotaStatusResponse;
import sm.proto.SportsMediatorServiceGrpc;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for SportsMediatorServiceImpl using InProcessServer.
 *
 * <p>Tests cover:
 * <ul>
 *   <li>Tool listing and calls end to end through cache and limiter</li>
 *   <li>Status mapping of every failure kind</li>
 *   <li>Quota, cache statistics and invalidation endpoints</li>
 *   <li>Health check endpoint</li>
 * </ul>
 */
class SportsMediatorServiceImplTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Server server;
    private ManagedChannel channel;
    private ExecutorService executor;
    private ManualClock clock;
    private QuotaRateLimiter limiter;
    private QueryCache cache;
    private SportsMediatorServiceGrpc.SportsMediatorServiceBlockingStub blockingStub;

    private final AtomicInteger upstreamCalls = new AtomicInteger();
    private volatile UpstreamBehavior behavior;

    @FunctionalInterface
    private interface UpstreamBehavior {
        JsonNode respond(QueryFamily family, Map<String, String> params) throws Exception;
    }

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock(0L);
        limiter = new QuotaRateLimiter(clock, RateLimiterConfig.of(30, 100).withJitter(0.0));
        cache = new QueryCache(clock, CacheConfig.defaults());
        executor = Executors.newFixedThreadPool(2);
        FetchOrchestrator orchestrator = new FetchOrchestrator(clock, limiter, cache,
            OrchestratorConfig.defaults().withTransportRetries(2, Duration.ofMillis(100)), executor);

        UpstreamCall upstream = (family, params) -> {
            upstreamCalls.incrementAndGet();
            try {
                return behavior.respond(family, params);
            } catch (UpstreamException | RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        };
        ToolRegistry tools = ToolRegistry.standard(orchestrator, upstream, MAPPER);

        String serverName = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(serverName)
            .directExecutor()
            .addService(new SportsMediatorServiceImpl(tools, limiter, cache, MAPPER))
            .build()
            .start();

        channel = InProcessChannelBuilder.forName(serverName)
            .directExecutor()
            .build();

        blockingStub = SportsMediatorServiceGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (channel != null) {
            channel.shutdown();
            channel.awaitTermination(5, TimeUnit.SECONDS);
        }
        if (server != null) {
            server.shutdown();
            server.awaitTermination(5, TimeUnit.SECONDS);
        }
        executor.shutdownNow();
    }

    private static CallToolRequest request(String tool, Map<String, String> args) {
        return CallToolRequest.newBuilder().setTool(tool).putAllArguments(args).build();
    }

    private static JsonNode teamsBody() throws Exception {
        return MAPPER.readTree("{\"response\":[{\"team\":{\"id\":33,\"name\":\"Manchester United\"},\"venue\":null}]}");
    }

    @Test
    void listTools_describesArguments() {
        ListToolsResponse response = blockingStub.listTools(ListToolsRequest.getDefaultInstance());

        assertEquals(10, response.getToolsCount());
        assertEquals("search_teams", response.getTools(0).getName());
        assertTrue(response.getToolsList().stream()
            .filter(t -> t.getName().equals("get_predictions"))
            .anyMatch(t -> t.getArguments(0).getName().equals("fixture") && t.getArguments(0).getRequired()));
    }

    @Test
    void callTool_returnsShapedJsonAndCaches() throws Exception {
        behavior = (family, params) -> teamsBody();

        CallToolResponse first = blockingStub.callTool(request("search_teams", Map.of("id", "33")));
        CallToolResponse second = blockingStub.callTool(request("search_teams", Map.of("id", "33")));

        JsonNode result = MAPPER.readTree(first.getResultJson());
        assertEquals("Manchester United", result.path("teams").path(0).path("name").asText());
        assertEquals(first.getResultJson(), second.getResultJson());
        assertEquals(1, upstreamCalls.get());

        CacheStatsResponse stats = blockingStub.getCacheStats(CacheStatsRequest.getDefaultInstance());
        assertEquals(1, stats.getSize());
        assertEquals(1, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(50.0, stats.getHitRate(), 1e-9);
    }

    @Test
    void unknownTool_isNotFound() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(request("get_odds", Map.of())));
        assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
    }

    @Test
    void emptyTool_isInvalidArgument() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(CallToolRequest.getDefaultInstance()));
        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
    }

    @Test
    void invalidArguments_isInvalidArgument() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(request("get_standings", Map.of("league", "39"))));
        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
        assertTrue(e.getStatus().getDescription().contains("season"));
        assertEquals(0, upstreamCalls.get());
    }

    @Test
    void quotaRejection_isResourceExhaustedWithRetryAfter() {
        behavior = (family, params) -> {
            throw new QuotaRejectedException("HTTP 429", Duration.ofSeconds(42), WindowKind.MINUTE);
        };

        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(request("search_teams", Map.of("id", "33"))));

        assertEquals(Status.Code.RESOURCE_EXHAUSTED, e.getStatus().getCode());
        assertEquals("42000", e.getTrailers().get(SportsMediatorServiceImpl.RETRY_AFTER_MS));

        QuotaStatusResponse quota = blockingStub.getQuotaStatus(QuotaStatusRequest.getDefaultInstance());
        assertEquals(1, quota.getConsecutiveRejections());
        assertEquals(42_000L, quota.getBackoffRemainingMillis());
    }

    @Test
    void transportFailure_isUnavailable() {
        behavior = (family, params) -> {
            throw new TransportException("connection reset");
        };

        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(request("search_teams", Map.of("id", "33"))));

        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        assertEquals(2, upstreamCalls.get());
    }

    @Test
    void upstreamRejection_isInvalidArgument() {
        behavior = (family, params) -> {
            throw new UpstreamRejectedException("The Team field must be an integer", 200);
        };

        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.callTool(request("search_teams", Map.of("id", "33"))));

        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
    }

    @Test
    void quotaStatus_reflectsAdmissions() {
        behavior = (family, params) -> teamsBody();
        blockingStub.callTool(request("search_teams", Map.of("id", "1")));
        blockingStub.callTool(request("search_teams", Map.of("id", "2")));

        QuotaStatusResponse quota = blockingStub.getQuotaStatus(QuotaStatusRequest.getDefaultInstance());

        assertEquals(28, quota.getMinuteRemaining());
        assertEquals(30, quota.getMinuteLimit());
        assertEquals(98, quota.getDayRemaining());
        assertEquals(100, quota.getDayLimit());
    }

    @Test
    void invalidateCache_byFamilyAndAll() {
        behavior = (family, params) -> teamsBody();
        blockingStub.callTool(request("search_teams", Map.of("id", "1")));
        blockingStub.callTool(request("search_teams", Map.of("id", "2")));

        assertEquals(0, blockingStub.invalidateCache(
            InvalidateCacheRequest.newBuilder().setFamily("leagues").build()).getRemoved());
        assertEquals(2, blockingStub.invalidateCache(
            InvalidateCacheRequest.newBuilder().setFamily("teams").build()).getRemoved());

        blockingStub.callTool(request("search_teams", Map.of("id", "1")));
        assertEquals(1, blockingStub.invalidateCache(InvalidateCacheRequest.getDefaultInstance()).getRemoved());
        assertEquals(3, upstreamCalls.get());
    }

    @Test
    void invalidateCache_unknownFamily() {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
            () -> blockingStub.invalidateCache(InvalidateCacheRequest.newBuilder().setFamily("odds").build()));
        assertEquals(Status.Code.INVALID_ARGUMENT, e.getStatus().getCode());
    }

    @Test
    void healthCheck_returnsServing() {
        HealthCheckResponse response = blockingStub.healthCheck(HealthCheckRequest.getDefaultInstance());
        assertEquals(HealthCheckResponse.Status.SERVING, response.getStatus());
    }
}
