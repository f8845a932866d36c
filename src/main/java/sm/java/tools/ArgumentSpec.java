package sm.java.tools;

/**
 * Declares one argument a tool accepts.
 *
 * @param name Argument name as callers send it
 * @param apiName Query parameter name upstream (e.g. {@code from_date} → {@code from})
 * @param type Accepted value format
 * @param required Whether the call fails without it
 * @param description Human readable description, listed with the tool
 */
public record ArgumentSpec(
    String name,
    String apiName,
    ArgumentType type,
    boolean required,
    String description
) {
    public ArgumentSpec {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name cannot be blank");
        if (apiName == null || apiName.isBlank()) throw new IllegalArgumentException("apiName cannot be blank");
        if (type == null) throw new IllegalArgumentException("type cannot be null");
        if (description == null) throw new IllegalArgumentException("description cannot be null");
    }

    public static ArgumentSpec optional(String name, ArgumentType type, String description) {
        return new ArgumentSpec(name, name, type, false, description);
    }

    public static ArgumentSpec required(String name, ArgumentType type, String description) {
        return new ArgumentSpec(name, name, type, true, description);
    }

    public ArgumentSpec sentAs(String upstreamName) {
        return new ArgumentSpec(name, upstreamName, type, required, description);
    }
}
