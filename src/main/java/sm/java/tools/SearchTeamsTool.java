package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

public final class SearchTeamsTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.optional("id", ArgumentType.INTEGER, "Team ID"),
        ArgumentSpec.optional("name", ArgumentType.TEXT, "Team name"),
        ArgumentSpec.optional("league", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.optional("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.optional("country", ArgumentType.TEXT, "Country name"),
        ArgumentSpec.optional("code", ArgumentType.TEXT, "3-letter team code"),
        ArgumentSpec.optional("venue", ArgumentType.INTEGER, "Venue ID"),
        ArgumentSpec.optional("search", ArgumentType.SEARCH, "Search string (minimum 3 characters)")
    );

    public SearchTeamsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "search_teams";
    }

    @Override
    public String description() {
        return "Search for football teams and retrieve their information";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.TEAMS;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected void check(ToolArguments args) {
        if (args.isEmpty()) {
            throw new IllegalArgumentException(name() + ": at least one filter is required");
        }
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode teams = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            JsonNode team = item.path("team");
            ObjectNode node = teams.addObject();
            copy(node, team, "id", "name", "code", "country", "founded");
            node.put("national", team.path("national").asBoolean(false));
            copy(node, team, "logo");
            node.set("venue", pick(item.get("venue"),
                "id", "name", "address", "city", "capacity", "surface", "image"));
        }
        return listResult("teams", teams);
    }
}
