package db.minipg.query;

import java.util.List;

/**
 * Compiled INSERT. {@code columns} is empty when the statement named none; the executor
 * then uses the table's declared columns. Each value tuple holds coerced scalars.
 */
public record InsertPlan(String table, List<String> columns, List<List<Object>> values) implements Plan {
    public InsertPlan {
        if (table == null || table.isBlank()) throw new IllegalArgumentException("table required");
        columns = List.copyOf(columns);
        // tuples may contain nulls, so no List.copyOf on the inner lists
        values = List.copyOf(values);
    }
}
