package db.minipg.exec;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions its child's rows by the group key and emits one row per group.
 *
 * Groups are emitted in the order their key was first seen; integral float keys fall in
 * the same group as the equal integer. The optional predicate is
 * applied to each group's rows before aggregation and a group left without rows is
 * dropped. Without group keys all rows form a single group, which is emitted even when
 * empty (so {@code COUNT(*)} over nothing yields 0).
 *
 * Output row: the group key columns, then the select list in order. Aggregates are
 * computed over the group's rows; plain columns take the first row's value.
 */
public class GroupAggregateOperator implements Operator {

    /** A GROUP BY column: output name as written and the row key it reads. */
    public record GroupKey(String outputName, String rowKey) {}

    /**
     * One select list entry. {@code function == null} is a plain column;
     * {@code allColumns} copies every column of the group's first row.
     */
    public record OutputColumn(String outputName, String rowKey, AggregateFunction function, boolean allColumns) {
        public static OutputColumn plain(String outputName, String rowKey) {
            return new OutputColumn(outputName, rowKey, null, false);
        }
        public static OutputColumn aggregate(String outputName, AggregateFunction function, String rowKey) {
            return new OutputColumn(outputName, rowKey, function, false);
        }
        public static OutputColumn all() {
            return new OutputColumn("*", null, null, true);
        }
    }

    private final Operator child;
    private final List<GroupKey> groupKeys;
    private final List<OutputColumn> outputs;
    private final Predicate groupFilter; // may be null

    private Iterator<Row> results;

    public GroupAggregateOperator(Operator child, List<GroupKey> groupKeys, List<OutputColumn> outputs, Predicate groupFilter) {
        this.child = child;
        this.groupKeys = List.copyOf(groupKeys);
        this.outputs = List.copyOf(outputs);
        this.groupFilter = groupFilter;
    }

    @Override
    public void open() {
        child.open();
        Map<List<Object>, List<Row>> groups = new LinkedHashMap<>();
        if (groupKeys.isEmpty()) groups.put(List.of(), new ArrayList<>());
        Row r;
        while ((r = child.next()) != null) {
            groups.computeIfAbsent(keyOf(r), k -> new ArrayList<>()).add(r);
        }
        List<Row> out = new ArrayList<>(groups.size());
        for (List<Row> members : groups.values()) {
            List<Row> kept = groupFilter == null ? members : filter(members);
            if (kept.isEmpty() && !groupKeys.isEmpty()) continue;
            out.add(emit(kept));
        }
        results = out.iterator();
    }

    private List<Object> keyOf(Row r) {
        List<Object> key = new ArrayList<>(groupKeys.size());
        for (GroupKey g : groupKeys) key.add(Values.normalizeKey(r.get(g.rowKey())));
        return key;
    }

    private List<Row> filter(List<Row> members) {
        List<Row> kept = new ArrayList<>(members.size());
        for (Row m : members) if (groupFilter.test(m)) kept.add(m);
        return kept;
    }

    private Row emit(List<Row> rows) {
        Row first = rows.isEmpty() ? null : rows.get(0);
        Map<String, Object> out = new LinkedHashMap<>();
        for (GroupKey g : groupKeys) out.put(g.outputName(), first.get(g.rowKey()));
        for (OutputColumn c : outputs) {
            if (c.function() != null) {
                out.put(c.outputName(), c.function().apply(rows, c.rowKey()));
            } else if (c.allColumns()) {
                if (first != null) first.values().forEach(out::putIfAbsent);
            } else if (!out.containsKey(c.outputName())) {
                out.put(c.outputName(), first == null ? null : first.get(c.rowKey()));
            }
        }
        return Row.of(out);
    }

    @Override
    public Row next() {
        return results != null && results.hasNext() ? results.next() : null;
    }

    @Override
    public void close() {
        child.close();
        results = null;
    }
}
