package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

/**
 * Per-team match statistics, with the upstream {@code [{type, value}]} list folded
 * into an object keyed by statistic name.
 */
public final class FixtureStatisticsTool extends FixtureDetailTool {

    public FixtureStatisticsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "fixture_statistics";
    }

    @Override
    public String description() {
        return "Retrieve detailed match statistics for a fixture";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.FIXTURE_STATISTICS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode teams = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            ObjectNode node = teams.addObject();
            node.set("team", pick(item.get("team"), "id", "name", "logo"));
            ObjectNode statistics = node.putObject("statistics");
            for (JsonNode stat : item.path("statistics")) {
                String type = stat.path("type").asText(null);
                if (type != null) {
                    statistics.set(type, stat.hasNonNull("value") ? stat.get("value").deepCopy() : statistics.nullNode());
                }
            }
        }
        return fixtureResult(body, "teams", teams);
    }
}
