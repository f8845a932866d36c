package sm.core.model;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Canonical key identifying cache-interchangeable queries.
 *
 * <p>Derivation:
 * <ul>
 *   <li>parameter names are trimmed and lower-cased, values trimmed</li>
 *   <li>null or blank values are dropped</li>
 *   <li>pairs are sorted by name, so construction order never matters</li>
 *   <li>the canonical form {@code family?k1=v1&k2=v2} is hashed with SHA-256</li>
 * </ul>
 *
 * <p>Equality uses family and digest only. The canonical form travels along so that
 * a digest collision between two distinct queries can be detected by the cache.
 */
public final class QueryFingerprint {

    private final QueryFamily family;
    private final String digest;
    private final String canonical;

    QueryFingerprint(QueryFamily family, String digest, String canonical) {
        this.family = family;
        this.digest = digest;
        this.canonical = canonical;
    }

    public static QueryFingerprint of(QueryFamily family, Map<String, String> parameters) {
        if (family == null) {
            throw new IllegalArgumentException("family cannot be null");
        }
        String canonical = canonicalForm(family, parameters);
        return new QueryFingerprint(family, sha256Hex(canonical), canonical);
    }

    /**
     * Normalized parameter map in key order: the exact set of parameters sent upstream.
     */
    public static TreeMap<String, String> normalize(Map<String, String> parameters) {
        TreeMap<String, String> sorted = new TreeMap<>();
        if (parameters == null) {
            return sorted;
        }
        for (Map.Entry<String, String> e : parameters.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                continue;
            }
            String name = e.getKey().trim().toLowerCase(Locale.ROOT);
            String value = e.getValue().trim();
            if (name.isEmpty() || value.isEmpty()) {
                continue;
            }
            sorted.put(name, value);
        }
        return sorted;
    }

    static String canonicalForm(QueryFamily family, Map<String, String> parameters) {
        StringJoiner query = new StringJoiner("&");
        normalize(parameters).forEach((name, value) ->
            query.add(encode(name) + "=" + encode(value)));
        return family.wireName() + "?" + query;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest sha256 = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha256.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(e);
        }
    }

    public QueryFamily family() {
        return family;
    }

    public String digest() {
        return digest;
    }

    public String canonical() {
        return canonical;
    }

    /** {@code family:digest}, the printable cache key. */
    public String value() {
        return family.wireName() + ":" + digest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryFingerprint)) return false;
        QueryFingerprint that = (QueryFingerprint) o;
        return family == that.family && digest.equals(that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, digest);
    }

    @Override
    public String toString() {
        return value();
    }
}
