package sm.core.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import sm.core.model.QueryFamily;

import java.util.Map;

/**
 * Capability to fetch one query from the network. Supplied by the transport.
 */
@FunctionalInterface
public interface UpstreamCall {

    JsonNode call(QueryFamily family, Map<String, String> parameters) throws UpstreamException;
}
