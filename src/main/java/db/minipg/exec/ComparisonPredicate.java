package db.minipg.exec;

/**
 * Compares a row column against a literal. A missing column reads as null.
 * Ordering operators are false when the two values have no common ordering
 * (for example a string against a number, or anything against null).
 */
public final class ComparisonPredicate implements Predicate {
    public enum Op {
        EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

        private final String symbol;

        Op(String symbol) { this.symbol = symbol; }

        public String symbol() { return symbol; }

        public static Op fromSymbol(String symbol) {
            for (Op op : values()) {
                if (op.symbol.equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unsupported operator: " + symbol);
        }
    }

    private final String column;
    private final Op op;
    private final Object literal;

    public ComparisonPredicate(String column, Op op, Object literal) {
        this.column = column;
        this.op = op;
        this.literal = literal;
    }

    public String column() { return column; }
    public Op op() { return op; }
    public Object literal() { return literal; }

    @Override
    public boolean test(Row row) {
        Object value = row.get(column);
        return switch (op) {
            case EQ -> Values.equalsValue(value, literal);
            case NE -> !Values.equalsValue(value, literal);
            case LT -> Values.comparable(value, literal) && Values.compare(value, literal) < 0;
            case LTE -> Values.comparable(value, literal) && Values.compare(value, literal) <= 0;
            case GT -> Values.comparable(value, literal) && Values.compare(value, literal) > 0;
            case GTE -> Values.comparable(value, literal) && Values.compare(value, literal) >= 0;
        };
    }

    @Override
    public String toString() {
        return column + " " + op.symbol() + " " + (literal instanceof String s ? "'" + s + "'" : literal);
    }
}
