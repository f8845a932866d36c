package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

/**
 * Season statistics of one team in one league. Upstream answers with a single object
 * in {@code response} rather than an array.
 */
public final class TeamStatisticsTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.required("league", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.required("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.required("team", ArgumentType.INTEGER, "Team ID"),
        ArgumentSpec.optional("date", ArgumentType.DATE, "Statistics up to this date (YYYY-MM-DD)")
    );

    public TeamStatisticsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "get_team_statistics";
    }

    @Override
    public String description() {
        return "Retrieve a team's statistics for a league season";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.TEAM_STATISTICS;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        JsonNode stats = items(body);
        if (stats != null && stats.isArray()) {
            stats = stats.isEmpty() ? null : stats.get(0);
        }

        ObjectNode result = mapper.createObjectNode();
        if (stats == null || !stats.isObject() || stats.isEmpty()) {
            result.put("found", false);
            result.set("statistics", mapper.createObjectNode());
            return result;
        }

        result.put("found", true);
        ObjectNode node = result.putObject("statistics");
        node.set("league", pick(stats.get("league"), "id", "name", "country", "logo", "season"));
        node.set("team", pick(stats.get("team"), "id", "name", "logo"));
        copy(node, stats, "form", "fixtures", "goals", "biggest", "clean_sheet",
            "failed_to_score", "penalty", "lineups", "cards");
        return result;
    }
}
