package sm.core.freshness;

import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle phase of a fixture, derived from its API-Sports status
 * (short code such as "FT", or long text such as "Match Finished").
 */
public enum FixturePhase {
    SCHEDULED,
    LIVE,
    FINISHED;

    private static final Set<String> FINISHED_CODES = Set.of(
        "FT", "AET", "PEN", "PST", "CANC", "ABD", "AWD", "WO");

    private static final Set<String> LIVE_CODES = Set.of(
        "1H", "HT", "2H", "ET", "BT", "P", "SUSP", "INT", "LIVE");

    private static final Set<String> FINISHED_NAMES = Set.of(
        "match finished",
        "match finished after extra time",
        "match finished after penalty",
        "match postponed",
        "match cancelled",
        "match abandoned",
        "technical loss",
        "walkover");

    private static final Set<String> LIVE_NAMES = Set.of(
        "first half, kick off",
        "halftime",
        "second half, 2nd half started",
        "extra time",
        "break time",
        "penalty in progress",
        "match suspended",
        "match interrupted",
        "in progress",
        "in play");

    /**
     * Classifies a status given as short code and/or long text. The short code wins
     * when both are known; unknown statuses count as scheduled.
     */
    public static FixturePhase of(String shortCode, String longName) {
        if (shortCode != null && !shortCode.isBlank()) {
            String code = shortCode.trim().toUpperCase(Locale.ROOT);
            if (FINISHED_CODES.contains(code)) return FINISHED;
            if (LIVE_CODES.contains(code)) return LIVE;
        }
        if (longName != null && !longName.isBlank()) {
            String name = longName.trim().toLowerCase(Locale.ROOT);
            if (FINISHED_NAMES.contains(name)) return FINISHED;
            if (LIVE_NAMES.contains(name)) return LIVE;
        }
        return SCHEDULED;
    }

    /**
     * Classifies a single status string that may be either a short code or a long name.
     */
    public static FixturePhase of(String status) {
        return of(status, status);
    }
}
