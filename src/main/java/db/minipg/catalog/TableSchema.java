package db.minipg.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable table definition: ordered column name to declared type, plus the declared
 * on-disk row order ({@code "<column> <ASC|DESC>"}, or null when unordered).
 */
public record TableSchema(String name, Map<String, String> columns, String sort) {
    /** Sort of tables whose physical order is insertion order. */
    public static final String APPEND_ONLY_SORT = "id ASC";
    /** Implicit sequence-backed column present on every inserted row. */
    public static final String ID_COLUMN = "id";

    public TableSchema {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("table name required");
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column) || ID_COLUMN.equals(column);
    }

    public boolean isAppendOnly() {
        return APPEND_ONLY_SORT.equals(sort);
    }

    public String sequenceName() {
        return sequenceNameFor(name);
    }

    public static String sequenceNameFor(String table) {
        return table + "_id_seq";
    }
}
