package sm.java.upstream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.model.QueryFamily;
import sm.core.model.WindowKind;
import sm.core.upstream.QuotaRejectedException;
import sm.core.upstream.TransportException;
import sm.core.upstream.UpstreamCall;
import sm.core.upstream.UpstreamException;
import sm.core.upstream.UpstreamRejectedException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * {@link UpstreamCall} over HTTP against API-Sports.
 *
 * <p>Response mapping:
 * <ul>
 *   <li>429: quota rejection, Retry-After as hint, DAY window when the daily counter is 0</li>
 *   <li>5xx, I/O failure, unparseable body: transport failure</li>
 *   <li>other non-200: upstream rejection</li>
 *   <li>200 with {@code errors}: quota rejection for {@code rateLimit}/{@code requests},
 *       upstream rejection otherwise</li>
 * </ul>
 *
 * <p>Thread-safety: stateless apart from the shared HttpClient, which is thread-safe.
 */
public final class ApiSportsHttpTransport implements UpstreamCall {

    private static final Logger log = LoggerFactory.getLogger(ApiSportsHttpTransport.class);

    static final String HEADER_KEY = "x-rapidapi-key";
    static final String HEADER_HOST = "x-rapidapi-host";
    static final String HEADER_DAY_REMAINING = "x-ratelimit-requests-remaining";
    static final String HEADER_MINUTE_REMAINING = "X-RateLimit-Remaining";

    private final TransportConfig config;
    private final HttpClient client;
    private final ObjectMapper mapper;

    public ApiSportsHttpTransport(TransportConfig config, ObjectMapper mapper) {
        this(config, HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build(), mapper);
    }

    ApiSportsHttpTransport(TransportConfig config, HttpClient client, ObjectMapper mapper) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        if (client == null) throw new IllegalArgumentException("client cannot be null");
        if (mapper == null) throw new IllegalArgumentException("mapper cannot be null");
        this.config = config;
        this.client = client;
        this.mapper = mapper;
    }

    @Override
    public JsonNode call(QueryFamily family, Map<String, String> parameters) throws UpstreamException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri(family, parameters))
            .timeout(config.requestTimeout())
            .header(HEADER_KEY, config.apiKey())
            .header(HEADER_HOST, config.host())
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("request to " + family.path() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("request to " + family.path() + " interrupted", e);
        }

        int status = response.statusCode();
        log.debug("UPSTREAM_RESPONSE path={} status={} minuteRemaining={} dayRemaining={}",
            family.path(), status,
            header(response, HEADER_MINUTE_REMAINING).orElse("-"),
            header(response, HEADER_DAY_REMAINING).orElse("-"));

        if (status == 429) {
            throw new QuotaRejectedException("HTTP 429 from " + family.path(), retryAfter(response), windowOf(response));
        }
        if (status >= 500) {
            throw new TransportException("HTTP " + status + " from " + family.path());
        }
        if (status != 200) {
            throw new UpstreamRejectedException("HTTP " + status + " from " + family.path() + ": " + abbreviate(response.body()), status);
        }

        JsonNode body;
        try {
            body = mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException("malformed JSON from " + family.path(), e);
        }
        if (body == null || !body.isObject()) {
            throw new TransportException("unexpected body from " + family.path());
        }
        checkErrors(family, body);
        return body;
    }

    URI uri(QueryFamily family, Map<String, String> parameters) {
        StringJoiner query = new StringJoiner("&");
        if (parameters != null) {
            parameters.forEach((name, value) -> query.add(encode(name) + "=" + encode(value)));
        }
        String q = query.toString();
        return URI.create(config.baseUrl() + family.path() + (q.isEmpty() ? "" : "?" + q));
    }

    /**
     * API-Sports reports many failures with status 200 and a non-empty {@code errors}
     * member, either an object keyed by field or an array of messages.
     */
    private static void checkErrors(QueryFamily family, JsonNode body) throws UpstreamException {
        JsonNode errors = body.path("errors");
        if (errors.isMissingNode() || errors.isNull() || errors.isEmpty()) {
            return;
        }

        if (errors.isObject()) {
            if (errors.hasNonNull("requests")) {
                throw new QuotaRejectedException(errors.get("requests").asText(), null, WindowKind.DAY);
            }
            if (errors.hasNonNull("rateLimit")) {
                throw new QuotaRejectedException(errors.get("rateLimit").asText(), null, WindowKind.MINUTE);
            }
        }

        StringJoiner messages = new StringJoiner("; ");
        if (errors.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = errors.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                messages.add(field.getKey() + ": " + field.getValue().asText());
            }
        } else {
            for (JsonNode message : errors) {
                messages.add(message.asText());
            }
        }
        throw new UpstreamRejectedException("API error on " + family.path() + ": " + messages, 200);
    }

    private static Duration retryAfter(HttpResponse<?> response) {
        Optional<String> value = header(response, "Retry-After");
        if (value.isEmpty()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.get().trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            log.debug("UPSTREAM_RETRY_AFTER unparseable value={}", value.get());
            return null;
        }
    }

    private static WindowKind windowOf(HttpResponse<?> response) {
        return header(response, HEADER_DAY_REMAINING)
            .map(String::trim)
            .filter("0"::equals)
            .map(v -> WindowKind.DAY)
            .orElse(WindowKind.MINUTE);
    }

    private static Optional<String> header(HttpResponse<?> response, String name) {
        return response.headers().firstValue(name);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
