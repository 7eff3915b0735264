package db.minipg.exec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Execution pipeline unit: an ordered, immutable column name to value mapping.
 * Joins and projections build new rows instead of mutating existing ones.
 */
public final class Row {
    private final Map<String, Object> values;

    private Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Row of(Map<String, Object> values) {
        return new Row(new LinkedHashMap<>(values));
    }

    /** Copy of {@code values} with every column renamed to {@code "<prefix>.<column>"}. */
    public static Row prefixed(String prefix, Map<String, Object> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            out.put(prefix + "." + e.getKey(), e.getValue());
        }
        return new Row(out);
    }

    public Object get(String column) { return values.get(column); }
    public boolean has(String column) { return values.containsKey(column); }
    public Set<String> columns() { return values.keySet(); }
    public Map<String, Object> values() { return values; }

    /** New row holding this row's columns followed by {@code other}'s (other wins on clashes). */
    public Row merge(Row other) {
        Map<String, Object> out = new LinkedHashMap<>(values);
        out.putAll(other.values);
        return new Row(out);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Row r && values.equals(r.values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Row" + values; }
}
