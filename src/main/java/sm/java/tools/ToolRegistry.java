package sm.java.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import sm.core.upstream.UpstreamCall;
import sm.java.engine.FetchOrchestrator;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tools by name, in registration order.
 */
public final class ToolRegistry {

    private final Map<String, SportsTool> tools;

    public ToolRegistry(List<? extends SportsTool> tools) {
        if (tools == null) throw new IllegalArgumentException("tools cannot be null");
        Map<String, SportsTool> byName = new LinkedHashMap<>();
        for (SportsTool tool : tools) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("duplicate tool name: " + tool.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    /**
     * Registry with every API-Sports tool.
     */
    public static ToolRegistry standard(FetchOrchestrator orchestrator, UpstreamCall upstream, ObjectMapper mapper) {
        return new ToolRegistry(List.of(
            new SearchTeamsTool(orchestrator, upstream, mapper),
            new GetFixturesTool(orchestrator, upstream, mapper),
            new HeadToHeadTool(orchestrator, upstream, mapper),
            new FixtureStatisticsTool(orchestrator, upstream, mapper),
            new FixtureEventsTool(orchestrator, upstream, mapper),
            new FixtureLineupsTool(orchestrator, upstream, mapper),
            new TeamStatisticsTool(orchestrator, upstream, mapper),
            new StandingsTool(orchestrator, upstream, mapper),
            new PredictionsTool(orchestrator, upstream, mapper),
            new SearchLeaguesTool(orchestrator, upstream, mapper)
        ));
    }

    public Optional<SportsTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<SportsTool> all() {
        return tools.values();
    }
}
