package db.minipg.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Projection operator: builds output rows from the requested columns of child rows.
 * A column missing from the child row projects as null.
 */
public class ProjectionOperator implements Operator {

    /**
     * One requested column. {@code tablePrefix != null} is a {@code table.*} entry that copies
     * every column named {@code "<tablePrefix>.<column>"}.
     */
    public record Item(String outputName, String rowKey, String tablePrefix) {
        public static Item column(String outputName, String rowKey) {
            return new Item(outputName, rowKey, null);
        }
        public static Item tableWildcard(String table) {
            return new Item(table + ".*", null, table);
        }
    }

    private final Operator child;
    private final List<Item> items;

    public ProjectionOperator(Operator child, List<Item> items) {
        if (items == null || items.isEmpty()) throw new IllegalArgumentException("projection items must be non-empty");
        this.child = child;
        this.items = List.copyOf(items);
    }

    @Override
    public void open() { child.open(); }

    @Override
    public Row next() {
        Row r = child.next();
        if (r == null) return null;
        Map<String, Object> projected = new LinkedHashMap<>();
        for (Item item : items) {
            if (item.tablePrefix() != null) {
                String prefix = item.tablePrefix() + ".";
                for (Map.Entry<String, Object> e : r.values().entrySet()) {
                    if (e.getKey().startsWith(prefix)) projected.put(e.getKey(), e.getValue());
                }
            } else {
                projected.put(item.outputName(), r.get(item.rowKey()));
            }
        }
        return Row.of(projected);
    }

    @Override
    public void close() { child.close(); }
}
