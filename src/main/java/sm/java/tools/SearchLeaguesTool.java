package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

public final class SearchLeaguesTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.optional("id", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.optional("name", ArgumentType.TEXT, "League name"),
        ArgumentSpec.optional("country", ArgumentType.TEXT, "Country name"),
        ArgumentSpec.optional("code", ArgumentType.TEXT, "Country code (FR, GB-ENG, ...)"),
        ArgumentSpec.optional("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.optional("team", ArgumentType.INTEGER, "Leagues a team played in"),
        ArgumentSpec.optional("type", ArgumentType.TEXT, "'league' or 'cup'"),
        ArgumentSpec.optional("current", ArgumentType.TEXT, "'true' for current seasons only"),
        ArgumentSpec.optional("search", ArgumentType.SEARCH, "Search string (minimum 3 characters)")
    );

    public SearchLeaguesTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "search_leagues";
    }

    @Override
    public String description() {
        return "Search for leagues and cups with their available seasons";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.LEAGUES;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode leagues = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            JsonNode league = item.path("league");
            ObjectNode node = leagues.addObject();
            copy(node, league, "id", "name", "type", "logo");
            node.set("country", pick(item.get("country"), "name", "code", "flag"));
            ArrayNode seasons = node.putArray("seasons");
            for (JsonNode season : item.path("seasons")) {
                ObjectNode s = seasons.addObject();
                copy(s, season, "year", "start", "end", "current");
            }
        }
        return listResult("leagues", leagues);
    }
}
