package sm.java.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sm.core.error.FetchException;
import sm.core.model.QueryFamily;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.List;
import java.util.Map;

/**
 * Base class of the tool layer: validates arguments, fetches through the orchestrator
 * and shapes the raw {@code response} array into a compact result.
 *
 * <p>Subclasses declare their arguments and family and implement {@link #shape}.
 * Cross-argument rules go in {@link #check}.
 */
public abstract class SportsTool {

    private static final Logger log = LoggerFactory.getLogger(SportsTool.class);

    protected final ObjectMapper mapper;
    private final FetchOrchestrator orchestrator;
    private final UpstreamCall upstream;

    protected SportsTool(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        if (orchestrator == null) throw new IllegalArgumentException("orchestrator cannot be null");
        if (upstream == null) throw new IllegalArgumentException("upstream cannot be null");
        if (mapper == null) throw new IllegalArgumentException("mapper cannot be null");
        this.orchestrator = orchestrator;
        this.upstream = upstream;
        this.mapper = mapper;
    }

    public abstract String name();

    public abstract String description();

    public abstract QueryFamily family();

    public abstract List<ArgumentSpec> arguments();

    /**
     * Builds the tool result from the upstream body.
     */
    protected abstract ObjectNode shape(JsonNode body);

    /**
     * Rules spanning several arguments. Default accepts everything.
     *
     * @throws IllegalArgumentException when the combination is invalid
     */
    protected void check(ToolArguments args) {
    }

    /**
     * Runs the tool.
     *
     * @param rawArguments Arguments as received, by caller-facing name
     * @return Shaped JSON result
     * @throws IllegalArgumentException on invalid arguments
     * @throws FetchException when the data cannot be obtained
     */
    public final ObjectNode call(Map<String, String> rawArguments) throws FetchException {
        ToolArguments args = ToolArguments.validate(name(), arguments(), rawArguments);
        check(args);
        log.info("TOOL_CALL tool={} params={}", name(), args.apiParameters());
        JsonNode body = orchestrator.fetch(family(), args.apiParameters(), upstream);
        return shape(body);
    }

    protected static JsonNode items(JsonNode body) {
        return body == null ? null : body.path("response");
    }

    /**
     * Copies the named fields, writing JSON null for missing ones.
     */
    protected static void copy(ObjectNode target, JsonNode source, String... fields) {
        for (String field : fields) {
            JsonNode value = source == null ? null : source.get(field);
            if (value == null) {
                target.putNull(field);
            } else {
                target.set(field, value.deepCopy());
            }
        }
    }

    /**
     * Object with the named fields of {@code source}, or null when source is absent.
     */
    protected ObjectNode pick(JsonNode source, String... fields) {
        if (source == null || !source.isObject()) {
            return null;
        }
        ObjectNode node = mapper.createObjectNode();
        copy(node, source, fields);
        return node;
    }

    protected ObjectNode listResult(String key, ArrayNode list) {
        ObjectNode result = mapper.createObjectNode();
        result.set(key, list);
        result.put("count", list.size());
        return result;
    }
}
