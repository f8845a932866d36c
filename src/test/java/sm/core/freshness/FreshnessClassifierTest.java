package sm.core.freshness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import sm.core.model.QueryFamily;
import sm.core.model.TtlClass;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FreshnessClassifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode fixtures(String... statuses) throws Exception {
        StringBuilder json = new StringBuilder("{\"response\":[");
        for (int i = 0; i < statuses.length; i++) {
            if (i > 0) json.append(',');
            json.append("{\"fixture\":{\"id\":").append(i).append(",\"status\":")
                .append(statuses[i]).append("}}");
        }
        return MAPPER.readTree(json.append("]}").toString());
    }

    @Test
    void finishedFixture_isPermanent() throws Exception {
        JsonNode payload = fixtures("{\"long\":\"Match Finished\",\"short\":\"FT\",\"elapsed\":90}");
        assertEquals(TtlClass.PERMANENT, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of("id", "1"), payload));
    }

    @Test
    void longNameOnly_isEnough() throws Exception {
        assertEquals(TtlClass.PERMANENT, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of(),
            fixtures("{\"long\":\"Match Finished\"}")));
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of(),
            fixtures("{\"long\":\"In Play\"}")));
    }

    @Test
    void anyLiveFixture_isNone() throws Exception {
        JsonNode payload = fixtures("{\"short\":\"FT\"}", "{\"short\":\"2H\"}", "{\"short\":\"NS\"}");
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of("date", "2024-03-02"), payload));
    }

    @Test
    void scheduledFixtures_areMedium() throws Exception {
        JsonNode payload = fixtures("{\"short\":\"FT\"}", "{\"short\":\"NS\"}");
        assertEquals(TtlClass.MEDIUM, FreshnessClassifier.classify(QueryFamily.HEAD_TO_HEAD, Map.of("h2h", "33-34"), payload));
    }

    @Test
    void liveParameter_isNoneRegardlessOfResult() throws Exception {
        JsonNode payload = fixtures("{\"short\":\"FT\"}");
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of("live", "all"), payload));
    }

    @Test
    void emptyFixtureResult_isNone() throws Exception {
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of(), fixtures()));
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURES, Map.of(), MAPPER.readTree("{}")));
    }

    @Test
    void referenceData_isLong() {
        assertEquals(TtlClass.LONG, FreshnessClassifier.classify(QueryFamily.TEAMS, Map.of(), null));
        assertEquals(TtlClass.LONG, FreshnessClassifier.classify(QueryFamily.LEAGUES, Map.of(), null));
    }

    @Test
    void aggregates_areMedium() {
        assertEquals(TtlClass.MEDIUM, FreshnessClassifier.classify(QueryFamily.TEAM_STATISTICS, Map.of(), null));
        assertEquals(TtlClass.MEDIUM, FreshnessClassifier.classify(QueryFamily.STANDINGS, Map.of(), null));
        assertEquals(TtlClass.MEDIUM, FreshnessClassifier.classify(QueryFamily.PREDICTIONS, Map.of(), null));
    }

    @Test
    void fixtureDetails_mediumUnlessEmpty() throws Exception {
        JsonNode events = MAPPER.readTree(
            "{\"response\":[{\"time\":{\"elapsed\":23},\"type\":\"Goal\",\"detail\":\"Normal Goal\"}]}");
        JsonNode empty = MAPPER.readTree("{\"response\":[]}");

        assertEquals(TtlClass.MEDIUM, FreshnessClassifier.classify(QueryFamily.FIXTURE_EVENTS, Map.of("fixture", "1"), events));
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURE_EVENTS, Map.of("fixture", "1"), empty));
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURE_STATISTICS, Map.of("fixture", "1"), null));
        assertEquals(TtlClass.NONE, FreshnessClassifier.classify(QueryFamily.FIXTURE_LINEUPS, Map.of("fixture", "1"), empty));
    }
}
