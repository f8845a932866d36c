package sm.java.tools;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Arguments of one tool call after validation against the tool's {@link ArgumentSpec}s.
 * Blank values count as absent.
 */
public final class ToolArguments {

    private final Map<String, String> values;

    private ToolArguments(Map<String, String> values) {
        this.values = values;
    }

    /**
     * @throws IllegalArgumentException on an unknown argument, a missing required one,
     *     or a malformed value
     */
    public static ToolArguments validate(String tool, List<ArgumentSpec> specs, Map<String, String> raw) {
        Map<String, ArgumentSpec> byName = new LinkedHashMap<>();
        for (ArgumentSpec spec : specs) {
            byName.put(spec.name(), spec);
        }

        Map<String, String> values = new LinkedHashMap<>();
        if (raw != null) {
            TreeSet<String> unknown = new TreeSet<>();
            for (Map.Entry<String, String> e : raw.entrySet()) {
                ArgumentSpec spec = byName.get(e.getKey());
                if (spec == null) {
                    unknown.add(e.getKey());
                    continue;
                }
                String value = e.getValue() == null ? "" : e.getValue().trim();
                if (value.isEmpty()) {
                    continue;
                }
                String problem = spec.type().check(value);
                if (problem != null) {
                    throw new IllegalArgumentException(tool + ": " + spec.name() + " " + problem + ", got: " + value);
                }
                values.put(spec.name(), value);
            }
            if (!unknown.isEmpty()) {
                throw new IllegalArgumentException(tool + ": unknown argument(s) " + unknown
                    + "; accepted: " + byName.keySet());
            }
        }

        for (ArgumentSpec spec : specs) {
            if (spec.required() && !values.containsKey(spec.name())) {
                throw new IllegalArgumentException(tool + ": " + spec.name() + " is required");
            }
        }

        // Upstream names, in declaration order.
        Map<String, String> ordered = new LinkedHashMap<>();
        for (ArgumentSpec spec : specs) {
            String value = values.get(spec.name());
            if (value != null) {
                ordered.put(spec.apiName(), value);
            }
        }
        return new ToolArguments(Collections.unmodifiableMap(ordered));
    }

    public Optional<String> get(String apiName) {
        return Optional.ofNullable(values.get(apiName));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Query parameters keyed by their upstream names. */
    public Map<String, String> apiParameters() {
        return values;
    }
}
