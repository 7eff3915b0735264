package db.minipg.exec;

/**
 * Stops pulling from its child once {@code limit} rows have been emitted.
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final int limit;
    private int emitted;

    public LimitOperator(Operator child, int limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() {
        emitted = 0;
        child.open();
    }

    @Override
    public Row next() {
        if (emitted >= limit) return null;
        Row r = child.next();
        if (r != null) emitted++;
        return r;
    }

    @Override
    public void close() { child.close(); }
}
