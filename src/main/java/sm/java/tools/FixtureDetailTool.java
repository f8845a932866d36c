package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

/**
 * Base of the tools that read one detail section of a single fixture.
 */
public abstract class FixtureDetailTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.required("fixture", ArgumentType.INTEGER, "Fixture ID")
    );

    protected FixtureDetailTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public final List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    /**
     * List result that also names the fixture the upstream answered for.
     */
    protected ObjectNode fixtureResult(JsonNode body, String key, ArrayNode list) {
        ObjectNode result = mapper.createObjectNode();
        JsonNode fixture = body == null ? null : body.path("parameters").get("fixture");
        if (fixture == null) {
            result.putNull("fixture");
        } else {
            result.put("fixture", fixture.asText());
        }
        result.set(key, list);
        result.put("count", list.size());
        return result;
    }
}
