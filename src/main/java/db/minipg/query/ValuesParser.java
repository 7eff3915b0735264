package db.minipg.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.exec.Values;

/**
 * Parses the tuples of an INSERT ... VALUES list and coerces each field.
 *
 * Coercion ladder for one field:
 * <ol>
 *   <li>a {@code ::type} suffix selects the conversion:
 *       {@code text}, {@code varchar}, {@code char} to string;
 *       {@code int}, {@code integer}, {@code bigint}, {@code smallint} to integer;
 *       {@code float}, {@code double precision}, {@code real} to float;
 *       {@code boolean} to {@code "true".equalsIgnoreCase(value)};
 *       {@code text[]} to the list of double-quoted substrings;</li>
 *   <li>a single-quoted field without a cast stays a string;</li>
 *   <li>otherwise integer, then float, then the raw text.</li>
 * </ol>
 */
public class ValuesParser {
    private static final Pattern ARRAY_ELEMENT = Pattern.compile("\"([^\"]*)\"");

    /**
     * @param valuesText the text after the VALUES keyword, e.g. {@code ('a', 1), ('b', 2)}
     */
    public List<List<Object>> parse(String valuesText) {
        List<List<Object>> tuples = new ArrayList<>();
        for (String group : splitGroups(valuesText)) {
            List<Object> tuple = new ArrayList<>();
            for (String field : splitFields(group)) tuple.add(coerce(field.trim()));
            tuples.add(tuple);
        }
        return tuples;
    }

    Object coerce(String field) {
        String value = field;
        String cast = null;
        int castAt = castSeparator(field);
        if (castAt >= 0) {
            value = field.substring(0, castAt).trim();
            cast = field.substring(castAt + 2).trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        }
        boolean quoted = value.length() >= 2 && value.startsWith("'") && value.endsWith("'");
        if (quoted) value = value.substring(1, value.length() - 1).replace("''", "'");

        if (cast != null) {
            switch (cast) {
                case "text", "varchar", "char":
                    return value;
                case "int", "integer", "bigint", "smallint": {
                    Long l = Values.parseInteger(value);
                    if (l == null) throw malformed("Cannot cast '" + value + "' to " + cast);
                    return l;
                }
                case "float", "double precision", "real": {
                    Double d = Values.parseFloat(value);
                    if (d == null) throw malformed("Cannot cast '" + value + "' to " + cast);
                    return d;
                }
                case "boolean":
                    return value.equalsIgnoreCase("true");
                case "text[]": {
                    List<Object> items = new ArrayList<>();
                    Matcher m = ARRAY_ELEMENT.matcher(value);
                    while (m.find()) items.add(m.group(1));
                    return items;
                }
                default:
                    // unknown cast: fall through to the untyped ladder
                    break;
            }
        }
        if (quoted) return value;
        Long l = Values.parseInteger(value);
        if (l != null) return l;
        Double d = Values.parseFloat(value);
        if (d != null) return d;
        return value;
    }

    // "::" outside a quoted literal, or -1
    private static int castSeparator(String field) {
        boolean inQuote = false;
        for (int i = 0; i < field.length() - 1; i++) {
            char c = field.charAt(i);
            if (c == '\'') inQuote = !inQuote;
            else if (!inQuote && c == ':' && field.charAt(i + 1) == ':') return i;
        }
        return -1;
    }

    private static List<String> splitGroups(String text) {
        List<String> groups = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '(') {
                int close = closingParen(text, i);
                String inner = text.substring(i + 1, close);
                if (inner.isBlank()) throw malformed("Empty value tuple in: " + text.trim());
                groups.add(inner);
                i = close + 1;
            } else if (c == ',' || Character.isWhitespace(c)) {
                i++;
            } else {
                throw malformed("Expected '(' at position " + i + " in: " + text.trim());
            }
        }
        if (groups.isEmpty()) throw malformed("INSERT has no value tuples");
        return groups;
    }

    private static int closingParen(String text, int open) {
        int depth = 0;
        boolean inQuote = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote) {
                if (c == '(') depth++;
                else if (c == ')' && --depth == 0) return i;
            }
        }
        throw malformed("Unbalanced parentheses in: " + text.trim());
    }

    // Commas inside quotes, braces or nested parentheses do not separate fields.
    private static List<String> splitFields(String group) {
        List<String> fields = new ArrayList<>();
        int depth = 0;
        boolean inQuote = false;
        int start = 0;
        for (int i = 0; i < group.length(); i++) {
            char c = group.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote) {
                if (c == '{' || c == '(') depth++;
                else if ((c == '}' || c == ')') && depth > 0) depth--;
                else if (c == ',' && depth == 0) {
                    fields.add(group.substring(start, i));
                    start = i + 1;
                }
            }
        }
        fields.add(group.substring(start));
        return fields;
    }

    private static DbException malformed(String message) {
        return new DbException(ErrorKind.MALFORMED_INSERT, message);
    }
}
