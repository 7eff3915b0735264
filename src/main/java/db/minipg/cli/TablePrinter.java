package db.minipg.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Simple ASCII table printer for query result rows.
 * Headers are the union of the rows' column names in first-seen order; a column
 * missing from a row prints as {@code null}.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(List<Map<String, Object>> rows) {
        print(rows, System.out);
    }

    public static void print(List<Map<String, Object>> rows, PrintStream out) {
        if (rows == null || rows.isEmpty()) {
            out.println("(0 row(s))");
            return;
        }
        Set<String> columns = new LinkedHashSet<>();
        for (Map<String, Object> r : rows) columns.addAll(r.keySet());
        String[] headers = columns.toArray(new String[0]);
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) widths[i] = headers[i].length();
        List<String[]> cells = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            String[] line = new String[headers.length];
            for (int i = 0; i < headers.length; i++) {
                line[i] = String.valueOf(r.get(headers[i]));
                if (line[i].length() > widths[i]) widths[i] = line[i].length();
            }
            cells.add(line);
        }
        String divLine = buildDivider(widths);
        out.println(divLine);
        out.println(buildLine(headers, widths));
        out.println(divLine);
        for (String[] line : cells) {
            out.println(buildLine(line, widths));
        }
        out.println(divLine);
        out.println("(" + rows.size() + " row(s))");
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            divider.append("-".repeat(w + 2));
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] values, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < values.length; i++) {
            sb.append(' ').append(pad(values[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
