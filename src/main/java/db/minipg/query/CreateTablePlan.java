package db.minipg.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Compiled CREATE TABLE: table name and declared columns in order. */
public record CreateTablePlan(String table, Map<String, String> columns) implements Plan {
    public CreateTablePlan {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
