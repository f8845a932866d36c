package sm.java.tools;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Value formats a tool argument can take. Every argument travels as a string; the
 * type only decides what a well-formed string looks like.
 */
public enum ArgumentType {
    TEXT,
    INTEGER,
    /** {@code YYYY-MM-DD} */
    DATE,
    /** Four-digit season year. */
    SEASON,
    /** Free-text search, at least {@value #MIN_SEARCH_LENGTH} characters. */
    SEARCH;

    static final int MIN_SEARCH_LENGTH = 3;

    private static final Pattern INTEGER_PATTERN = Pattern.compile("-?\\d{1,10}");
    private static final Pattern SEASON_PATTERN = Pattern.compile("\\d{4}");

    /**
     * @return null when valid, otherwise the reason the value is rejected
     */
    String check(String value) {
        switch (this) {
            case INTEGER:
                return INTEGER_PATTERN.matcher(value).matches() ? null : "must be an integer";
            case DATE:
                try {
                    LocalDate.parse(value);
                    return value.length() == 10 ? null : "must be in YYYY-MM-DD format";
                } catch (DateTimeParseException e) {
                    return "must be in YYYY-MM-DD format";
                }
            case SEASON:
                return SEASON_PATTERN.matcher(value).matches() ? null : "must be a four-digit year (YYYY)";
            case SEARCH:
                return value.length() >= MIN_SEARCH_LENGTH
                    ? null
                    : "must be at least " + MIN_SEARCH_LENGTH + " characters long";
            case TEXT:
            default:
                return null;
        }
    }
}
