package sm.java.upstream;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for the API-Sports endpoint.
 *
 * @param baseUrl API root, e.g. {@code https://v3.football.api-sports.io}
 * @param apiKey Account key sent with every request
 * @param connectTimeout TCP connect timeout
 * @param requestTimeout Whole-request timeout
 */
public record TransportConfig(
    URI baseUrl,
    String apiKey,
    Duration connectTimeout,
    Duration requestTimeout
) {
    public static final String DEFAULT_BASE_URL = "https://v3.football.api-sports.io";

    public TransportConfig {
        if (baseUrl == null) throw new IllegalArgumentException("baseUrl cannot be null");
        if (apiKey == null) throw new IllegalArgumentException("apiKey cannot be null");
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be > 0");
        }
    }

    public static TransportConfig of(String baseUrl, String apiKey) {
        return new TransportConfig(URI.create(stripTrailingSlash(baseUrl)), apiKey,
            Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    /** Value of the host header API-Sports expects alongside the key. */
    public String host() {
        return baseUrl.getHost();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) throw new IllegalArgumentException("baseUrl cannot be null");
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
