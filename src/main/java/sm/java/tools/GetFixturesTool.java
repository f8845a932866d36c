package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

public final class GetFixturesTool extends SportsTool {

    private static final int MAX_LAST_NEXT = 99;

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.optional("id", ArgumentType.INTEGER, "Fixture ID"),
        ArgumentSpec.optional("ids", ArgumentType.TEXT, "Multiple fixture IDs separated by '-' (max 20)"),
        ArgumentSpec.optional("live", ArgumentType.TEXT, "'all' or league IDs separated by '-'"),
        ArgumentSpec.optional("date", ArgumentType.DATE, "Date (YYYY-MM-DD)"),
        ArgumentSpec.optional("league", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.optional("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.optional("team", ArgumentType.INTEGER, "Team ID"),
        ArgumentSpec.optional("last", ArgumentType.INTEGER, "Last N matches (max 2 digits)"),
        ArgumentSpec.optional("next", ArgumentType.INTEGER, "Next N matches (max 2 digits)"),
        ArgumentSpec.optional("from_date", ArgumentType.DATE, "Start date (YYYY-MM-DD)").sentAs("from"),
        ArgumentSpec.optional("to_date", ArgumentType.DATE, "End date (YYYY-MM-DD)").sentAs("to"),
        ArgumentSpec.optional("round", ArgumentType.TEXT, "Round name"),
        ArgumentSpec.optional("status", ArgumentType.TEXT, "Match status (NS, PST, FT, ...)"),
        ArgumentSpec.optional("venue", ArgumentType.INTEGER, "Venue ID"),
        ArgumentSpec.optional("timezone", ArgumentType.TEXT, "Timezone for dates")
    );

    public GetFixturesTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "get_fixtures";
    }

    @Override
    public String description() {
        return "Retrieve football fixtures (matches) with filtering by date, league, team or status";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.FIXTURES;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected void check(ToolArguments args) {
        for (String bounded : List.of("last", "next")) {
            args.get(bounded).ifPresent(v -> {
                int n = Integer.parseInt(v);
                if (n < 1 || n > MAX_LAST_NEXT) {
                    throw new IllegalArgumentException(name() + ": " + bounded + " must be between 1 and "
                        + MAX_LAST_NEXT + ", got: " + v);
                }
            });
        }
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        ArrayNode fixtures = mapper.createArrayNode();
        for (JsonNode item : items(body)) {
            FixtureShapes.appendFixture(this, fixtures, item);
        }
        return listResult("fixtures", fixtures);
    }
}
