package db.minipg.exec;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.minipg.DbException;

/**
 * Aggregates computed over all rows of a group. {@code COUNT(*)} counts rows; the others
 * (and {@code COUNT(column)}) read one column and skip null values.
 */
public enum AggregateFunction {
    SUM, COUNT, AVG, MAX, MIN;

    private static final Pattern CALL = Pattern.compile(
        "\\s*(SUM|COUNT|AVG|MAX|MIN)\\s*\\(\\s*(.+?)\\s*\\)\\s*", Pattern.CASE_INSENSITIVE);

    /** A parsed {@code FUNC(argument)} select entry; argument is {@code *} or a column name. */
    public record Call(AggregateFunction function, String argument) {
        public boolean isStar() { return "*".equals(argument); }
    }

    /** Parses {@code SUM(age)}, {@code count(*)}, ...; null when the text is not an aggregate call. */
    public static Call parse(String selectEntry) {
        Matcher m = CALL.matcher(selectEntry);
        if (!m.matches()) return null;
        return new Call(valueOf(m.group(1).toUpperCase(Locale.ROOT)), m.group(2));
    }

    public static boolean isAggregate(String selectEntry) {
        return parse(selectEntry) != null;
    }

    /**
     * Apply to a group.
     *
     * @param column row key to read, or null for {@code COUNT(*)}
     */
    public Object apply(List<Row> rows, String column) {
        if (this == COUNT && column == null) return (long) rows.size();
        if (column == null) throw DbException.planError(name() + " requires a column argument");
        return switch (this) {
            case COUNT -> rows.stream().filter(r -> r.get(column) != null).count();
            case SUM -> sum(rows, column);
            case AVG -> avg(rows, column);
            case MAX -> extreme(rows, column, true);
            case MIN -> extreme(rows, column, false);
        };
    }

    private Object sum(List<Row> rows, String column) {
        long longSum = 0L;
        double doubleSum = 0.0;
        boolean anyFloat = false;
        boolean any = false;
        for (Row r : rows) {
            Number n = numeric(r.get(column), column);
            if (n == null) continue;
            any = true;
            if (ValueType.of(n) == ValueType.INTEGER) {
                longSum += n.longValue();
            } else {
                anyFloat = true;
                doubleSum += n.doubleValue();
            }
        }
        if (!any) return null;
        if (anyFloat) return doubleSum + longSum;
        return longSum;
    }

    private Object avg(List<Row> rows, String column) {
        double total = 0.0;
        int count = 0;
        for (Row r : rows) {
            Number n = numeric(r.get(column), column);
            if (n == null) continue;
            total += n.doubleValue();
            count++;
        }
        if (count == 0) return null;
        return total / count;
    }

    private Object extreme(List<Row> rows, String column, boolean max) {
        Object best = null;
        for (Row r : rows) {
            Object v = r.get(column);
            if (v == null) continue;
            if (best == null) {
                best = v;
                continue;
            }
            int c = Values.compare(v, best);
            if (max ? c > 0 : c < 0) best = v;
        }
        return best;
    }

    private Number numeric(Object v, String column) {
        if (v == null) return null;
        if (!ValueType.of(v).isNumeric()) {
            throw DbException.planError("Cannot compute " + name() + " over non-numeric value '" + v + "' in column '" + column + "'");
        }
        return (Number) v;
    }
}
