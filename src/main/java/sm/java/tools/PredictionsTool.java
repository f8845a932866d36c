package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;

public final class PredictionsTool extends SportsTool {

    private static final List<ArgumentSpec> ARGUMENTS = List.of(
        ArgumentSpec.required("fixture", ArgumentType.INTEGER, "Fixture ID")
    );

    public PredictionsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        super(orchestrator, upstream, mapper);
    }

    @Override
    public String name() {
        return "get_predictions";
    }

    @Override
    public String description() {
        return "Retrieve the upstream prediction and team comparison for a fixture";
    }

    @Override
    public QueryFamily family() {
        return QueryFamily.PREDICTIONS;
    }

    @Override
    public List<ArgumentSpec> arguments() {
        return ARGUMENTS;
    }

    @Override
    protected ObjectNode shape(JsonNode body) {
        JsonNode first = items(body).path(0);
        ObjectNode result = mapper.createObjectNode();
        copy(result, first, "predictions", "comparison", "teams");
        return result;
    }
}
