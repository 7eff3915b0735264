package db.minipg.query;

import java.util.Locale;

/**
 * Join keyword written in the statement. Recorded on the plan; execution is inner join
 * for every kind.
 */
public enum JoinKind {
    JOIN, INNER, LEFT, RIGHT, FULL;

    /** Maps {@code JOIN}, {@code INNER JOIN}, {@code LEFT OUTER JOIN}, ... to a kind; null if not a join keyword. */
    public static JoinKind fromKeyword(String keyword) {
        String k = keyword.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
        return switch (k) {
            case "JOIN" -> JOIN;
            case "INNER JOIN" -> INNER;
            case "LEFT JOIN", "LEFT OUTER JOIN" -> LEFT;
            case "RIGHT JOIN", "RIGHT OUTER JOIN" -> RIGHT;
            case "FULL JOIN", "FULL OUTER JOIN" -> FULL;
            default -> null;
        };
    }
}
