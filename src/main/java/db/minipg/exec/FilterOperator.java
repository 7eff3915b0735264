package db.minipg.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Passes through the child rows that satisfy a WHERE predicate, in child order.
 * Rows the predicate rejects are counted; the count is logged when the operator closes.
 */
public class FilterOperator implements Operator {
    private static final Logger log = LoggerFactory.getLogger(FilterOperator.class);

    private final Operator child;
    private final Predicate predicate;
    private long passed;
    private long rejected;

    public FilterOperator(Operator child, Predicate predicate) {
        this.child = child;
        this.predicate = predicate;
    }

    @Override
    public void open() {
        passed = 0;
        rejected = 0;
        child.open();
    }

    @Override
    public Row next() {
        for (Row r = child.next(); r != null; r = child.next()) {
            if (predicate.test(r)) {
                passed++;
                return r;
            }
            rejected++;
        }
        return null;
    }

    /** Rows dropped by the predicate since the last {@link #open()}. */
    public long rejectedRows() { return rejected; }

    @Override
    public void close() {
        child.close();
        log.debug("Filter {} passed {} row(s), rejected {}", predicate, passed, rejected);
    }
}
