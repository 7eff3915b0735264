package db.minipg.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk statistics refresh: tables refreshed and, per failed table, the reason.
 */
public record StatsRefreshReport(List<String> updated, Map<String, String> failures) {
    public StatsRefreshReport {
        updated = List.copyOf(updated);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
