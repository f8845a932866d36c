package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;
import java.util.regex.Pattern;

public final class HeadToHeadTool extends SportsTool {

    private static final Pattern PAIR = Pattern.compile("\\d+-\\d+");

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.required("h2h", ArgumentType.TEXT, "Two team IDs as 'id-id'"),
        ArgumentSpec.optional("date", ArgumentType.DATE, "Date (YYYY-MM-DD)"),
        ArgumentSpec.optional("league", ArgumentType.INTEGER, "League ID"),
        ArgumentSpec.optional("season", ArgumentType.SEASON, "Season year (YYYY)"),
        ArgumentSpec.optional("last", ArgumentType.INTEGER, "Last N matches"),
        ArgumentSpec.optional("next", ArgumentType.INTEGER, "Next N matches"),
        ArgumentSpec.optional("from_date", ArgumentType.DATE, "Start date (YYYY-MM-DD)").sentAs("from"),
        ArgumentSpec.optional("to_date", ArgumentType.DATE, "End date (YYYY-MM-DD)").sentAs("to"),
        ArgumentSpec.optional("status", ArgumentType.TEXT, "Match status"),
        ArgumentSpec.optional("timezone", ArgumentType.TEXT, "Timezone for dates")
    );

    public HeadToHeadTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "get_head_to_head";
    }

    @Override
    public String description() {
        return "Retrieve the fixtures played between two teams";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.HEAD_TO_HEAD;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected void check(ToolArguments args) {
        String pair = args.get("h2h").orElse("");
        if (!PAIR.matcher(pair).matches()) {
            throw new IllegalArgumentException(name() + ": h2h must be two team IDs as 'id-id', got: " + pair);
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
