package sm.core.model;

import java.util.Locale;

/**
 * Logical categories of upstream request, one per API-Sports endpoint.
 */
public enum QueryFamily {
    TEAMS("/teams"),
    FIXTURES("/fixtures"),
    HEAD_TO_HEAD("/fixtures/headtohead"),
    FIXTURE_STATISTICS("/fixtures/statistics"),
    FIXTURE_EVENTS("/fixtures/events"),
    FIXTURE_LINEUPS("/fixtures/lineups"),
    TEAM_STATISTICS("/teams/statistics"),
    STANDINGS("/standings"),
    PREDICTIONS("/predictions"),
    LEAGUES("/leagues");

    private final String path;
    private final String wireName;

    QueryFamily(String path) {
        this.path = path;
        this.wireName = name().toLowerCase(Locale.ROOT);
    }

    public String path() {
        return path;
    }

    /** Stable lower-case name used as fingerprint prefix and on the wire. */
    public String wireName() {
        return wireName;
    }

    public static QueryFamily fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("family cannot be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown query family: " + name, e);
        }
    }
}
