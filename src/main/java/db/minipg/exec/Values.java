package db.minipg.exec;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Comparison and parsing rules for dynamically typed row values.
 */
public final class Values {
    private static final Pattern DECIMAL = Pattern.compile(
        "[+-]?(\\d[\\d_]*(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d[\\d_]*");

    /** Total order used by sort, min and max. */
    public static final Comparator<Object> ORDER = Values::compare;

    private Values() {}

    /**
     * Total order: null, booleans, numbers, strings, lists, maps. Numbers compare by value
     * across integer and float, lists element-wise then by length.
     */
    public static int compare(Object a, Object b) {
        ValueType ta = ValueType.of(a);
        ValueType tb = ValueType.of(b);
        if (ta.rank() != tb.rank()) return Integer.compare(ta.rank(), tb.rank());
        return switch (ta) {
            case NULL -> 0;
            case BOOLEAN -> Boolean.compare((Boolean) a, (Boolean) b);
            case INTEGER, FLOAT -> compareNumbers((Number) a, (Number) b);
            case STRING -> ((String) a).compareTo((String) b);
            case LIST -> compareLists((List<?>) a, (List<?>) b);
            case MAP -> a.toString().compareTo(b.toString());
        };
    }

    /** Equality with integer and float values of the same magnitude considered equal. */
    public static boolean equalsValue(Object a, Object b) {
        ValueType ta = ValueType.of(a);
        ValueType tb = ValueType.of(b);
        if (ta.isNumeric() && tb.isNumeric()) return compareNumbers((Number) a, (Number) b) == 0;
        return Objects.equals(a, b);
    }

    /** Whether an ordering comparison (&lt;, &gt;, ...) between the two values is meaningful. */
    public static boolean comparable(Object a, Object b) {
        ValueType ta = ValueType.of(a);
        ValueType tb = ValueType.of(b);
        if (ta.isNumeric() && tb.isNumeric()) return true;
        return ta == tb && (ta == ValueType.STRING || ta == ValueType.BOOLEAN);
    }

    /**
     * Parse a decimal integer (optional sign, digits, underscores between digits).
     * Returns null when the text is not an integer or does not fit a long.
     */
    public static Long parseInteger(String text) {
        String s = text.trim();
        if (!INTEGER.matcher(s).matches() || s.endsWith("_")) return null;
        try {
            return Long.parseLong(s.replace("_", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parse a decimal float literal, also accepting {@code inf}, {@code infinity} and
     * {@code nan} in any case. Returns null when the text is not a float.
     */
    public static Double parseFloat(String text) {
        String s = text.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        String unsigned = lower.startsWith("+") || lower.startsWith("-") ? lower.substring(1) : lower;
        if (unsigned.equals("inf") || unsigned.equals("infinity")) {
            return lower.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals("nan")) return Double.NaN;
        if (!DECIMAL.matcher(s).matches() || s.endsWith("_")) return null;
        try {
            return Double.parseDouble(s.replace("_", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Value used for hashing and bucketing: a float with an integral value in long range
     * becomes that Long, so keys agree with {@link #equalsValue}.
     */
    public static Object normalizeKey(Object v) {
        if (ValueType.of(v) != ValueType.FLOAT) return v;
        double d = ((Number) v).doubleValue();
        if (Double.isInfinite(d) || d != Math.rint(d)) return v;
        if (d < Long.MIN_VALUE || d >= 0x1p63) return v;
        return (long) d;
    }

    /** JSON-style text of a value, used as a histogram bucket key. Integral floats print as integers. */
    public static String toKeyString(Object v) {
        v = normalizeKey(v);
        return switch (ValueType.of(v)) {
            case NULL -> "null";
            case BOOLEAN, INTEGER, STRING -> v.toString();
            case FLOAT -> {
                double d = ((Number) v).doubleValue();
                if (Double.isNaN(d)) yield "NaN";
                if (Double.isInfinite(d)) yield d > 0 ? "Infinity" : "-Infinity";
                yield Double.toString(d);
            }
            case LIST, MAP -> v.toString();
        };
    }

    private static int compareNumbers(Number a, Number b) {
        if (ValueType.of(a) == ValueType.INTEGER && ValueType.of(b) == ValueType.INTEGER) {
            return Long.compare(a.longValue(), b.longValue());
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static int compareLists(List<?> a, List<?> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }
}
