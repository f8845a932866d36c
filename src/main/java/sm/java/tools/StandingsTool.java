package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

/**
 * League table. Upstream nests rows as {@code response[].league.standings[][]}, one
 * inner array per group; rows are flattened and keep their group name.
 */
public final class StandingsTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.required("league", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.required("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.optional("team", ArgumentType.INTEGER, "Only this team's row")
    );

    public StandingsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "get_standings";
    }

    @Override
    public String description() {
        return "Retrieve the standings table of a league season";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.STANDINGS;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode rows = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            for (JsonNode group : item.path("league").path("standings")) {
                for (JsonNode row : group) {
                    ObjectNode node = rows.addObject();
                    copy(node, row, "rank");
                    node.set("team", pick(row.get("team"), "id", "name", "logo"));
                    copy(node, row, "points", "goalsDiff", "group", "form", "description", "all");
                }
            }
        }
        return listResult("standings", rows);
    }
}
