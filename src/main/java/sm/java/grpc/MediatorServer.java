package sm.java.grpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.cache.QueryCache;
import sm.core.clock.Clock;
import sm.core.clock.SystemClock;
import sm.core.ratelimit.QuotaRateLimiter;
import sm.java.config.MediatorSettings;
import sm.java.engine.CacheJanitor;
import sm.java.engine.FetchOrchestrator;
import sm.java.tools.ToolRegistry;
import sm.java.upstream.ApiSportsHttpTransport;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Standalone gRPC server for the mediator.
 *
 * <p>Wiring: settings, clock, limiter, cache, orchestrator, HTTP transport, tools, service.
 * The cache janitor runs while the server is up.
 *
 * <p>Usage:
 * <pre>
 * API_SPORTS_API_KEY=... java -jar api-sports-mediator.jar [port]
 * </pre>
 */
public final class MediatorServer {

    private static final Logger log = LoggerFactory.getLogger(MediatorServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final CacheJanitor janitor;
    private final ExecutorService fetchExecutor;

    /**
     * Builds the full stack from settings. Requires an API key.
     *
     * @param settings Loaded settings
     * @param port Port to listen on
     */
    public MediatorServer(MediatorSettings settings, int port) {
        Clock clock = SystemClock.instance();
        ObjectMapper mapper = new ObjectMapper();

        QuotaRateLimiter limiter = new QuotaRateLimiter(clock, settings.rateLimiter());
        QueryCache cache = new QueryCache(clock, settings.cache());
        this.fetchExecutor = Executors.newFixedThreadPool(settings.fetchWorkers(), fetchThreads());
        FetchOrchestrator orchestrator =
            new FetchOrchestrator(clock, limiter, cache, settings.orchestrator(), fetchExecutor);
        ApiSportsHttpTransport transport = new ApiSportsHttpTransport(settings.transport(), mapper);
        ToolRegistry tools = ToolRegistry.standard(orchestrator, transport, mapper);

        this.janitor = new CacheJanitor(cache);
        this.server = ServerBuilder.forPort(port)
            .addService(new SportsMediatorServiceImpl(tools, limiter, cache, mapper))
            .build();
    }

    /**
     * Starts the server and the janitor, and registers a JVM shutdown hook.
     *
     * @throws IOException if the server fails to bind
     */
    public void start() throws IOException {
        server.start();
        janitor.start();
        log.info("MediatorServer started on port: {}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                MediatorServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully, then the janitor and fetch workers.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        janitor.close();
        fetchExecutor.shutdownNow();
        log.info("MediatorServer stopped.");
    }

    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }

    private static ThreadFactory fetchThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * @param args Optional: port number, overriding {@code grpc.port}
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        MediatorSettings settings = MediatorSettings.load();
        int port = settings.grpcPort();

        if (args.length > 0) {
            try {
                port = Integer.parseInt(args[0]);
            } catch (NumberFormatException e) {
                log.error("Invalid port: {}", args[0]);
                System.exit(1);
            }
        }

        if (settings.apiKey().isEmpty()) {
            log.error("No API key configured; set API_SPORTS_API_KEY");
            System.exit(1);
        }

        MediatorServer server = new MediatorServer(settings, port);
        server.start();
        server.blockUntilShutdown();
    }
}
