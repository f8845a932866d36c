package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

public final class FixtureLineupsTool extends FixtureDetailTool {

    public FixtureLineupsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "fixture_lineups";
    }

    @Override
    public String description() {
        return "Retrieve team lineups, formations and coaches for a fixture";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.FIXTURE_LINEUPS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode lineups = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            ObjectNode lineup = lineups.addObject();
            lineup.set("team", pick(item.get("team"), "id", "name", "logo"));
            copy(lineup, item, "formation");
            lineup.set("coach", pick(item.get("coach"), "id", "name", "photo"));
            lineup.set("startXI", players(item.path("startXI")));
            lineup.set("substitutes", players(item.path("substitutes")));
        }
        return fixtureResult(body, "lineups", lineups);
    }

    private ArrayNode players(JsonNode entries) {
        ArrayNode players = mapper.createArrayNode();
        for (JsonNode entry : entries) {
            players.add(pick(entry.get("player"), "id", "name", "number", "pos", "grid"));
        }
        return players;
    }
}
