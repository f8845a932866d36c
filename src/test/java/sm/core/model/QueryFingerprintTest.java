package sm.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryFingerprintTest {

    @Test
    void parameterOrder_doesNotMatter() {
        Map<String, String> a = new LinkedHashMap<>();
        a.put("league", "39");
        a.put("season", "2023");
        Map<String, String> b = new LinkedHashMap<>();
        b.put("season", "2023");
        b.put("league", "39");

        assertEquals(QueryFingerprint.of(QueryFamily.STANDINGS, a), QueryFingerprint.of(QueryFamily.STANDINGS, b));
        assertEquals(QueryFingerprint.of(QueryFamily.STANDINGS, a).hashCode(),
            QueryFingerprint.of(QueryFamily.STANDINGS, b).hashCode());
    }

    @Test
    void blankValuesAndCase_areNormalized() {
        Map<String, String> noisy = new HashMap<>();
        noisy.put(" League ", " 39 ");
        noisy.put("season", "2023");
        noisy.put("team", "  ");
        noisy.put("round", null);

        QueryFingerprint fp = QueryFingerprint.of(QueryFamily.STANDINGS, noisy);

        assertEquals(QueryFingerprint.of(QueryFamily.STANDINGS, Map.of("league", "39", "season", "2023")), fp);
        assertEquals("standings?league=39&season=2023", fp.canonical());
    }

    @Test
    void differentFamilies_neverCollide() {
        Map<String, String> params = Map.of("id", "33");
        assertNotEquals(QueryFingerprint.of(QueryFamily.TEAMS, params), QueryFingerprint.of(QueryFamily.FIXTURES, params));
    }

    @Test
    void differentValues_differentFingerprints() {
        assertNotEquals(
            QueryFingerprint.of(QueryFamily.TEAMS, Map.of("id", "33")),
            QueryFingerprint.of(QueryFamily.TEAMS, Map.of("id", "34")));
    }

    @Test
    void value_isFamilyPrefixedSha256() {
        QueryFingerprint fp = QueryFingerprint.of(QueryFamily.TEAMS, Map.of("search", "arsenal"));

        assertTrue(fp.value().startsWith("teams:"));
        assertEquals(64, fp.digest().length());
        assertTrue(fp.digest().matches("[0-9a-f]+"));
    }

    @Test
    void separatorsInValues_areEscaped() {
        QueryFingerprint joined = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("a", "1&b=2"));
        QueryFingerprint split = QueryFingerprint.of(QueryFamily.FIXTURES, Map.of("a", "1", "b", "2"));
        assertNotEquals(joined, split);
    }

    @Test
    void nullFamily_rejected() {
        assertThrows(IllegalArgumentException.class, () -> QueryFingerprint.of(null, Map.of()));
    }
}
