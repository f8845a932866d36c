package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Match timeline (goals, cards, substitutions, VAR) ordered by elapsed and added time.
 */
public final class FixtureEventsTool extends FixtureDetailTool {

    private static final Comparator<JsonNode> BY_TIME = Comparator
        .<JsonNode>comparingInt(e -> e.path("time").path("elapsed").asInt(0))
        .thenComparingInt(e -> e.path("time").path("extra").asInt(0));

    public FixtureEventsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "fixture_events";
    }

    @Override
    public String description() {
        return "Retrieve the timeline of events (goals, cards, substitutions) for a fixture";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.FIXTURE_EVENTS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        List<JsonNode> timeline = new ArrayList<>();
        items(body).forEach(timeline::add);
        timeline.sort(BY_TIME);

        ArrayNode events = mapper.createArrayNode();
        for (JsonNode item : timeline) {
            ObjectNode event = events.addObject();
            event.set("time", pick(item.get("time"), "elapsed", "extra"));
            event.set("team", pick(item.get("team"), "id", "name", "logo"));
            event.set("player", pick(item.get("player"), "id", "name"));
            event.set("assist", pick(item.get("assist"), "id", "name"));
            copy(event, item, "type", "detail", "comments");
        }
        return fixtureResult(body, "events", events);
    }
}
