package sm.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sm.core.clock.ManualClock;
import sm.core.error.FetchException;
import sm.core.error.InvariantViolationException;
import sm.core.model.CacheEntry;
import sm.core.model.Fingerprints;
import sm.core.model.QueryFamily;
import sm.core.model.QueryFingerprint;
import sm.core.model.TtlClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryCacheTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManualClock clock;
    private QueryCache cache;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(0L);
        cache = new QueryCache(clock, CacheConfig.defaults());
    }

    private static QueryFingerprint teams(String id) {
        return QueryFingerprint.of(QueryFamily.TEAMS, Map.of("id", id));
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Test
    void storeThenLookup_returnsPayload() throws Exception {
        cache.store(teams("33"), json("{\"name\":\"Manchester United\"}"), TtlClass.LONG);

        Optional<CacheEntry> hit = cache.lookup(teams("33"));

        assertTrue(hit.isPresent());
        assertEquals("Manchester United", hit.get().payload().path("name").asText());
        assertEquals(TtlClass.LONG, hit.get().ttlClass());
    }

    @Test
    void peek_countsHitsButNotMisses() throws Exception {
        assertTrue(cache.peek(teams("33")).isEmpty());
        cache.store(teams("33"), json("{\"name\":\"Manchester United\"}"), TtlClass.LONG);
        assertTrue(cache.peek(teams("33")).isPresent());

        CacheStats stats = cache.stats();
        assertEquals(0, stats.misses());
        assertEquals(1, stats.hits());
    }

    @Test
    void lastWriteWins() throws Exception {
        cache.store(teams("33"), json("{\"v\":1}"), TtlClass.LONG);
        cache.store(teams("33"), json("{\"v\":2}"), TtlClass.MEDIUM);

        CacheEntry entry = cache.lookup(teams("33")).orElseThrow();
        assertEquals(2, entry.payload().path("v").asInt());
        assertEquals(TtlClass.MEDIUM, entry.ttlClass());
        assertEquals(1, cache.size());
    }

    @Test
    void mediumTtl_expiresAfterOneHour() throws Exception {
        QueryFingerprint fp = QueryFingerprint.of(QueryFamily.STANDINGS, Map.of("league", "39", "season", "2023"));
        cache.store(fp, json("{}"), TtlClass.MEDIUM);

        clock.advanceSeconds(59 * 60);
        assertTrue(cache.lookup(fp).isPresent());

        clock.advanceSeconds(2 * 60);
        assertTrue(cache.lookup(fp).isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.stats().expirations());
    }

    @Test
    void expiry_isExactBoundary() throws Exception {
        cache.store(teams("1"), json("{}"), TtlClass.LONG);

        clock.advanceNanos(Duration.ofHours(24).toNanos() - 1);
        assertTrue(cache.lookup(teams("1")).isPresent());

        clock.advanceNanos(1);
        assertTrue(cache.lookup(teams("1")).isEmpty());
    }

    @Test
    void permanent_neverExpires() throws Exception {
        QueryFingerprint fp = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "1035037"));
        cache.store(fp, json("{}"), TtlClass.PERMANENT);

        clock.advanceNanos(Duration.ofDays(3650).toNanos());

        CacheEntry entry = cache.lookup(fp).orElseThrow();
        assertTrue(entry.isPermanent());
        assertEquals(0, cache.purgeExpired());
    }

    @Test
    void noneTtl_isNeverStoredAndRemovesExisting() throws Exception {
        cache.store(teams("7"), json("{}"), TtlClass.MEDIUM);

        cache.store(teams("7"), json("{}"), TtlClass.NONE);
        assertTrue(cache.lookup(teams("7")).isEmpty());

        cache.store(teams("8"), json("{}"), TtlClass.NONE);
        assertEquals(0, cache.size());
    }

    @Test
    void eviction_prefersNonPermanentLeastRecentlyUsed() throws Exception {
        List<QueryFingerprint> evicted = new ArrayList<>();
        QueryCache small = new QueryCache(clock, CacheConfig.ofMaxEntries(3), (fp, entry) -> evicted.add(fp));

        QueryFingerprint permanent = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "1"));
        small.store(permanent, json("{}"), TtlClass.PERMANENT);
        small.store(teams("a"), json("{}"), TtlClass.LONG);
        small.store(teams("b"), json("{}"), TtlClass.LONG);

        // touch "a" so "b" becomes the LRU non-permanent entry
        small.lookup(teams("a"));
        small.store(teams("c"), json("{}"), TtlClass.LONG);

        assertEquals(List.of(teams("b")), evicted);
        assertTrue(small.lookup(permanent).isPresent());
        assertTrue(small.lookup(teams("a")).isPresent());
        assertTrue(small.lookup(teams("c")).isPresent());
        assertEquals(1, small.stats().evictions());
    }

    @Test
    void eviction_fallsBackToPermanentWhenNothingElse() throws Exception {
        QueryCache small = new QueryCache(clock, CacheConfig.ofMaxEntries(2));
        QueryFingerprint p1 = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "1"));
        QueryFingerprint p2 = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "2"));
        QueryFingerprint p3 = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "3"));

        small.store(p1, json("{}"), TtlClass.PERMANENT);
        small.store(p2, json("{}"), TtlClass.PERMANENT);
        small.store(p3, json("{}"), TtlClass.PERMANENT);

        assertEquals(2, small.size());
        assertTrue(small.lookup(p1).isEmpty());
        assertTrue(small.lookup(p3).isPresent());
    }

    @Test
    void eviction_neverDropsEntryJustStored() throws Exception {
        QueryCache small = new QueryCache(clock, CacheConfig.ofMaxEntries(1));
        QueryFingerprint permanent = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("id", "1"));

        small.store(permanent, json("{}"), TtlClass.PERMANENT);
        small.store(teams("x"), json("{}"), TtlClass.MEDIUM);

        assertTrue(small.lookup(teams("x")).isPresent());
        assertTrue(small.lookup(permanent).isEmpty());
    }

    @Test
    void collision_isDetectedAndEntryKept() throws Exception {
        QueryFingerprint real = teams("33");
        cache.store(real, json("{\"v\":1}"), TtlClass.LONG);
        QueryFingerprint impostor = Fingerprints.colliding(real, "teams?id=999");

        InvariantViolationException e = assertThrows(InvariantViolationException.class, () -> cache.lookup(impostor));
        assertEquals(FetchException.Kind.INVARIANT_VIOLATION, e.kind());
        assertThrows(InvariantViolationException.class, () -> cache.store(impostor, json("{}"), TtlClass.LONG));

        assertEquals(1, cache.lookup(real).orElseThrow().payload().path("v").asInt());
    }

    @Test
    void disabled_missesAndIgnoresStores() throws Exception {
        QueryCache off = new QueryCache(clock, CacheConfig.disabled());

        off.store(teams("1"), json("{}"), TtlClass.LONG);

        assertTrue(off.lookup(teams("1")).isEmpty());
        assertEquals(0, off.size());
        assertFalse(off.stats().enabled());
    }

    @Test
    void purgeExpired_dropsOnlyExpired() throws Exception {
        cache.store(teams("1"), json("{}"), TtlClass.MEDIUM);
        cache.store(teams("2"), json("{}"), TtlClass.LONG);

        clock.advanceSeconds(2 * 3600);

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.lookup(teams("2")).isPresent());
    }

    @Test
    void invalidation() throws Exception {
        cache.store(teams("1"), json("{}"), TtlClass.LONG);
        cache.store(teams("2"), json("{}"), TtlClass.LONG);
        cache.store(QueryFingerprint.of(QueryFamily.LEAGUES, Map.of("id", "39")), json("{}"), TtlClass.LONG);

        assertEquals(1, cache.invalidate(teams("1")));
        assertEquals(0, cache.invalidate(teams("1")));
        assertEquals(1, cache.invalidateFamily(QueryFamily.TEAMS));
        assertEquals(1, cache.size());
        assertEquals(1, cache.clear());
        assertEquals(0, cache.size());
    }

    @Test
    void stats_countHitsAndMisses() throws Exception {
        cache.store(teams("1"), json("{}"), TtlClass.LONG);
        cache.lookup(teams("1"));
        cache.lookup(teams("1"));
        cache.lookup(teams("2"));

        CacheStats stats = cache.stats();
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(3, stats.totalRequests());
        assertEquals(200.0 / 3, stats.hitRate(), 1e-9);
    }

    @Test
    void configuredTtls_override() throws Exception {
        CacheConfig config = new CacheConfig(true, 10, Duration.ofMinutes(5), Duration.ofMinutes(1), Duration.ZERO);
        QueryCache custom = new QueryCache(clock, config);
        custom.store(teams("1"), json("{}"), TtlClass.LONG);

        clock.advanceSeconds(5 * 60);

        assertTrue(custom.lookup(teams("1")).isEmpty());
    }
}
