package sm.core.freshness;

import com.fasterxml.jackson.databind.JsonNode;
import sm.core.model.QueryFamily;
import sm.core.model.TtlClass;

import java.util.Map;

/**
 * Maps a query and its result to the freshness class it may be cached under.
 *
 * <pre>
 * teams, leagues (reference data)       LONG
 * fixtures, all finished                PERMANENT
 * fixtures, scheduled                   MEDIUM
 * fixtures, any live / live request     NONE
 * fixtures, empty result                NONE
 * statistics, standings, predictions    MEDIUM
 * fixture statistics, events, lineups   MEDIUM, NONE when empty
 * </pre>
 *
 * Fixture detail payloads carry no match status, so a finished match cannot be told
 * from one in progress; they never go beyond MEDIUM.
 *
 * Pure and stateless.
 */
public final class FreshnessClassifier {

    private FreshnessClassifier() {
        // Utility class, no instantiation
    }

    public static TtlClass classify(QueryFamily family, Map<String, String> parameters, JsonNode payload) {
        if (family == null) throw new IllegalArgumentException("family cannot be null");

        return switch (family) {
            case TEAMS, LEAGUES -> TtlClass.LONG;
            case TEAM_STATISTICS, STANDINGS, PREDICTIONS -> TtlClass.MEDIUM;
            case FIXTURES, HEAD_TO_HEAD -> classifyFixtures(parameters, payload);
            case FIXTURE_STATISTICS, FIXTURE_EVENTS, FIXTURE_LINEUPS -> hasItems(payload) ? TtlClass.MEDIUM : TtlClass.NONE;
        };
    }

    private static TtlClass classifyFixtures(Map<String, String> parameters, JsonNode payload) {
        if (parameters != null && hasText(parameters.get("live"))) {
            return TtlClass.NONE;
        }

        JsonNode fixtures = payload == null ? null : payload.path("response");
        if (fixtures == null || !fixtures.isArray() || fixtures.isEmpty()) {
            return TtlClass.NONE;
        }

        boolean allFinished = true;
        for (JsonNode item : fixtures) {
            JsonNode status = item.path("fixture").path("status");
            FixturePhase phase = FixturePhase.of(text(status, "short"), text(status, "long"));
            if (phase == FixturePhase.LIVE) {
                return TtlClass.NONE;
            }
            if (phase != FixturePhase.FINISHED) {
                allFinished = false;
            }
        }
        return allFinished ? TtlClass.PERMANENT : TtlClass.MEDIUM;
    }

    private static boolean hasItems(JsonNode payload) {
        JsonNode items = payload == null ? null : payload.path("response");
        return items != null && items.isArray() && !items.isEmpty();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
