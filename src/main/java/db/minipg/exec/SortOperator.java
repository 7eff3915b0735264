package db.minipg.exec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Materializes its child and emits the rows stably sorted by one or more keys.
 * Rows with equal keys keep their input order.
 */
public class SortOperator implements Operator {

    /** One ORDER BY entry resolved to a row column. */
    public record SortKey(String column, boolean descending) {}

    private final Operator child;
    private final List<SortKey> keys;
    private Iterator<Row> sorted;

    public SortOperator(Operator child, List<SortKey> keys) {
        if (keys == null || keys.isEmpty()) throw new IllegalArgumentException("sort keys required");
        this.child = child;
        this.keys = List.copyOf(keys);
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) rows.add(r);
        rows.sort(comparator()); // List.sort is stable
        sorted = rows.iterator();
    }

    private Comparator<Row> comparator() {
        Comparator<Row> cmp = null;
        for (SortKey key : keys) {
            Comparator<Row> c = Comparator.comparing(row -> row.get(key.column()), Values.ORDER);
            if (key.descending()) c = c.reversed();
            cmp = cmp == null ? c : cmp.thenComparing(c);
        }
        return cmp;
    }

    @Override
    public Row next() {
        return sorted != null && sorted.hasNext() ? sorted.next() : null;
    }

    @Override
    public void close() {
        child.close();
        sorted = null;
    }
}
