package db.minipg.query;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.exec.ComparisonPredicate;
import db.minipg.exec.CompoundPredicate;
import db.minipg.exec.Predicate;
import db.minipg.exec.Values;

/**
 * Compiles WHERE text into a Predicate by textual splitting, not by a precedence parser:
 * <ol>
 *   <li>text containing {@code " AND "} is split on it and every part must hold
 *       (an {@code OR} inside a part is handled when that part is compiled);</li>
 *   <li>otherwise text containing {@code " OR "} is split on it and any part may hold;</li>
 *   <li>otherwise a leading {@code "NOT "} negates the rest;</li>
 *   <li>otherwise the text must be one comparison {@code left op right} with op one of
 *       {@code = < > <= >= !=}.</li>
 * </ol>
 * Parentheses are not supported. {@code a = 1 AND b = 2 OR c = 3} therefore means
 * {@code a = 1 AND (b = 2 OR c = 3)}.
 * The right-hand side is a single-quoted string, else a float, else the raw text.
 */
public class PredicateCompiler {
    private static final Pattern COMPARISON = Pattern.compile(
        "(.+?)\\s*(<=|>=|!=|=|<|>)\\s*(.+)", Pattern.DOTALL);

    /** Returns null for a null WHERE clause. Column names are used as written. */
    public Predicate compile(String where) {
        return compile(where, UnaryOperator.identity());
    }

    /**
     * @param columnKeys maps a column name as written to the row key it reads
     */
    public Predicate compile(String where, UnaryOperator<String> columnKeys) {
        if (where == null) return null;
        return compileExpression(where.trim(), columnKeys);
    }

    private Predicate compileExpression(String expression, UnaryOperator<String> columnKeys) {
        if (expression.contains(" AND ")) {
            return CompoundPredicate.and(compileParts(expression.split(" AND ", -1), columnKeys));
        }
        if (expression.contains(" OR ")) {
            return CompoundPredicate.or(compileParts(expression.split(" OR ", -1), columnKeys));
        }
        if (expression.startsWith("NOT ")) {
            return CompoundPredicate.not(compileExpression(expression.substring(4).trim(), columnKeys));
        }
        Matcher m = COMPARISON.matcher(expression);
        if (!m.matches()) {
            throw new DbException(ErrorKind.MALFORMED_PREDICATE, "Invalid expression: " + expression);
        }
        String left = columnKeys.apply(m.group(1).trim());
        ComparisonPredicate.Op op = ComparisonPredicate.Op.fromSymbol(m.group(2));
        return new ComparisonPredicate(left, op, parseLiteral(m.group(3).trim()));
    }

    private List<Predicate> compileParts(String[] parts, UnaryOperator<String> columnKeys) {
        List<Predicate> out = new ArrayList<>(parts.length);
        for (String part : parts) out.add(compileExpression(part.trim(), columnKeys));
        return out;
    }

    static Object parseLiteral(String raw) {
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1);
        }
        Double d = Values.parseFloat(raw);
        return d != null ? d : raw;
    }
}
