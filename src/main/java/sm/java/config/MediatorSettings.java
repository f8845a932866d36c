package sm.java.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.cache.CacheConfig;
import sm.core.ratelimit.RateLimiterConfig;
import sm.java.engine.OrchestratorConfig;
import sm.java.upstream.TransportConfig;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.function.UnaryOperator;

/**
 * Process settings, read from {@code mediator.properties} on the classpath with each key
 * overridable by an environment variable of the upper-snake-case name
 * ({@code rate.limit.calls.per.minute} ← {@code RATE_LIMIT_CALLS_PER_MINUTE}).
 *
 * <p>Durations accept ISO-8601 ({@code PT1H}) or plain seconds.
 */
public final class MediatorSettings {

    private static final Logger log = LoggerFactory.getLogger(MediatorSettings.class);

    public static final String RESOURCE = "mediator.properties";

    static final String API_KEY = "api.sports.api.key";
    static final String BASE_URL = "api.sports.base.url";
    static final String CONNECT_TIMEOUT = "api.sports.connect.timeout";
    static final String REQUEST_TIMEOUT = "api.sports.request.timeout";

    static final String CALLS_PER_MINUTE = "rate.limit.calls.per.minute";
    static final String CALLS_PER_DAY = "rate.limit.calls.per.day";
    static final String BACKOFF_BASE = "rate.limit.backoff.base";
    static final String BACKOFF_MAX = "rate.limit.backoff.max";
    static final String MAX_WAIT = "rate.limit.max.wait";
    static final String JITTER = "rate.limit.jitter";

    static final String CACHE_ENABLED = "cache.enabled";
    static final String CACHE_MAX_SIZE = "cache.max.size";
    static final String CACHE_TTL_LONG = "cache.ttl.long";
    static final String CACHE_TTL_MEDIUM = "cache.ttl.medium";
    static final String CACHE_PURGE_INTERVAL = "cache.purge.interval";

    static final String TRANSPORT_MAX_ATTEMPTS = "fetch.transport.max.attempts";
    static final String TRANSPORT_RETRY_DELAY = "fetch.transport.retry.delay";
    static final String ADMISSION_TIMEOUT = "fetch.admission.timeout";
    static final String ADMISSION_MAX_ATTEMPTS = "fetch.admission.max.attempts";
    static final String FETCH_TIMEOUT = "fetch.timeout";
    static final String FETCH_WORKERS = "fetch.workers";

    static final String GRPC_PORT = "grpc.port";

    public static final int DEFAULT_GRPC_PORT = 9090;
    public static final int DEFAULT_CALLS_PER_MINUTE = 30;
    public static final int DEFAULT_CALLS_PER_DAY = 100;
    public static final int DEFAULT_FETCH_WORKERS = 8;

    private final Properties properties;
    private final UnaryOperator<String> environment;

    MediatorSettings(Properties properties, UnaryOperator<String> environment) {
        if (properties == null) throw new IllegalArgumentException("properties cannot be null");
        if (environment == null) throw new IllegalArgumentException("environment cannot be null");
        this.properties = properties;
        this.environment = environment;
    }

    /**
     * Loads the classpath resource (if any) and the process environment.
     */
    public static MediatorSettings load() {
        return load(RESOURCE, System::getenv);
    }

    static MediatorSettings load(String resource, UnaryOperator<String> environment) {
        Properties properties = new Properties();
        try (InputStream in = MediatorSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            } else {
                log.info("SETTINGS_DEFAULTS resource={} not found", resource);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + resource, e);
        }
        return new MediatorSettings(properties, environment);
    }

    /** Upper-snake-case environment name of a property key. */
    static String environmentName(String key) {
        return key.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    public Optional<String> apiKey() {
        return value(API_KEY);
    }

    public int grpcPort() {
        return intValue(GRPC_PORT, DEFAULT_GRPC_PORT);
    }

    public int fetchWorkers() {
        return intValue(FETCH_WORKERS, DEFAULT_FETCH_WORKERS);
    }

    public RateLimiterConfig rateLimiter() {
        return new RateLimiterConfig(
            intValue(CALLS_PER_MINUTE, DEFAULT_CALLS_PER_MINUTE),
            intValue(CALLS_PER_DAY, DEFAULT_CALLS_PER_DAY),
            duration(BACKOFF_BASE, RateLimiterConfig.DEFAULT_BASE_BACKOFF),
            duration(BACKOFF_MAX, RateLimiterConfig.DEFAULT_MAX_BACKOFF),
            duration(MAX_WAIT, RateLimiterConfig.DEFAULT_MAX_WAIT),
            doubleValue(JITTER, RateLimiterConfig.DEFAULT_JITTER)
        );
    }

    public CacheConfig cache() {
        CacheConfig defaults = CacheConfig.defaults();
        return new CacheConfig(
            boolValue(CACHE_ENABLED, true),
            intValue(CACHE_MAX_SIZE, CacheConfig.DEFAULT_MAX_ENTRIES),
            duration(CACHE_TTL_LONG, defaults.longTtl()),
            duration(CACHE_TTL_MEDIUM, defaults.mediumTtl()),
            duration(CACHE_PURGE_INTERVAL, defaults.purgeInterval())
        );
    }

    public OrchestratorConfig orchestrator() {
        OrchestratorConfig defaults = OrchestratorConfig.defaults();
        return new OrchestratorConfig(
            intValue(TRANSPORT_MAX_ATTEMPTS, defaults.transportMaxAttempts()),
            duration(TRANSPORT_RETRY_DELAY, defaults.transportRetryDelay()),
            duration(ADMISSION_TIMEOUT, defaults.admissionTimeout()),
            intValue(ADMISSION_MAX_ATTEMPTS, defaults.maxAdmissionAttempts()),
            duration(FETCH_TIMEOUT, defaults.fetchTimeout())
        );
    }

    /**
     * @throws IllegalStateException when no API key is configured
     */
    public TransportConfig transport() {
        String key = apiKey().orElseThrow(() -> new IllegalStateException(
            "API key missing: set " + API_KEY + " or " + environmentName(API_KEY)));
        TransportConfig defaults = TransportConfig.of(TransportConfig.DEFAULT_BASE_URL, key);
        String base = value(BASE_URL).orElse(TransportConfig.DEFAULT_BASE_URL);
        return new TransportConfig(
            URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base),
            key,
            duration(CONNECT_TIMEOUT, defaults.connectTimeout()),
            duration(REQUEST_TIMEOUT, defaults.requestTimeout())
        );
    }

    Optional<String> value(String key) {
        String v = environment.apply(environmentName(key));
        if (v == null || v.isBlank()) {
            v = properties.getProperty(key);
        }
        if (v == null || v.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(v.trim());
    }

    private int intValue(String key, int fallback) {
        Optional<String> v = value(key);
        if (v.isEmpty()) return fallback;
        try {
            return Integer.parseInt(v.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got: " + v.get(), e);
        }
    }

    private double doubleValue(String key, double fallback) {
        Optional<String> v = value(key);
        if (v.isEmpty()) return fallback;
        try {
            return Double.parseDouble(v.get());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number, got: " + v.get(), e);
        }
    }

    private boolean boolValue(String key, boolean fallback) {
        Optional<String> v = value(key);
        if (v.isEmpty()) return fallback;
        String s = v.get().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("yes") || s.equals("1")) return true;
        if (s.equals("false") || s.equals("no") || s.equals("0")) return false;
        throw new IllegalArgumentException(key + " must be true or false, got: " + v.get());
    }

    private Duration duration(String key, Duration fallback) {
        Optional<String> v = value(key);
        if (v.isEmpty()) return fallback;
        return parseDuration(key, v.get());
    }

    static Duration parseDuration(String key, String text) {
        if (text.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(text));
        }
        try {
            return Duration.parse(text.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(key + " must be seconds or an ISO-8601 duration, got: " + text, e);
        }
    }
}
