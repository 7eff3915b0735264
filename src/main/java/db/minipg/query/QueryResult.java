package db.minipg.query;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement: a human-readable status message and, for successful
 * statements, the result rows (empty for INSERT and CREATE TABLE). Failed statements
 * carry an {@code "Error: "} message and null rows.
 */
public record QueryResult(String message, List<Map<String, Object>> rows) {
    public static final String ERROR_PREFIX = "Error: ";

    public static QueryResult error(String message) {
        return new QueryResult(ERROR_PREFIX + message, null);
    }

    public boolean isError() {
        return message.startsWith(ERROR_PREFIX);
    }

    public int rowCount() {
        return rows == null ? 0 : rows.size();
    }
}
