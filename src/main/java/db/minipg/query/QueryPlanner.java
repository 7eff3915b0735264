package db.minipg.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.sql.Token;
import db.minipg.sql.TokenKind;
import db.minipg.sql.TokenizedStatement;

/**
 * Compiles a tokenized statement into a {@link Plan}.
 *
 * SELECT is compiled by a one-pass state machine over the grouped tokens:
 * <pre>
 *   START -SELECT-> SELECT_LIST -FROM-> FROM -name-> JOIN_OR_CLAUSE
 *   JOIN_OR_CLAUSE -join keyword-> JOIN -name-> ON -comparison-> JOIN_OR_CLAUSE
 *   JOIN_OR_CLAUSE -where clause-> WHERE -> JOIN_OR_CLAUSE
 *   JOIN_OR_CLAUSE -ORDER BY / GROUP BY / LIMIT-> ORDER_BY / GROUP_BY / LIMIT -> JOIN_OR_CLAUSE
 * </pre>
 * Whitespace is skipped. Tokens a state does not expect are logged and ignored.
 *
 * CREATE TABLE is extracted from the statement text; INSERT by scanning for the INTO
 * target and the VALUES list.
 */
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private static final Pattern CREATE_TABLE_NAME = Pattern.compile("CREATE\\s+TABLE\\s+([^(]+?)\\s*\\(",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*");
    private static final Pattern LEADING_WHERE = Pattern.compile("^\\s*WHERE\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_VALUES = Pattern.compile("^\\s*VALUES\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIRECTION = Pattern.compile("(?i)^(.+?)\\s+(ASC|DESC)$");

    private enum State { START, SELECT_LIST, FROM, JOIN_OR_CLAUSE, JOIN, ON, WHERE, ORDER_BY, GROUP_BY, LIMIT }

    private final ValuesParser valuesParser = new ValuesParser();

    public Plan plan(TokenizedStatement statement) {
        Plan plan = switch (statement.command()) {
            case SELECT -> planSelect(statement.tokens());
            case INSERT -> planInsert(statement.tokens());
            case CREATE -> planCreateTable(statement.text());
            case UNSUPPORTED -> throw DbException.unsupported(
                statement.leadingWord().isEmpty() ? "UNKNOWN" : statement.leadingWord());
        };
        log.debug("Generated plan: {}", plan);
        return plan;
    }

    SelectPlan planSelect(List<Token> tokens) {
        List<String> select = new ArrayList<>();
        String from = null;
        Map<String, JoinSpec> joins = new LinkedHashMap<>();
        String where = null;
        List<String> groupBy = null;
        List<String> orderBy = null;
        Integer limit = null;

        State state = State.START;
        JoinKind joinKind = null;
        String joinTable = null;

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            if (token.is(TokenKind.WHITESPACE)) {
                i++;
                continue;
            }
            boolean consumed = true;
            switch (state) {
                case START -> {
                    if (token.isKeyword("SELECT")) state = State.SELECT_LIST;
                    else unresolved(state, token);
                }
                case SELECT_LIST -> {
                    if (token.isKeyword("FROM")) {
                        state = State.FROM;
                    } else if (token.is(TokenKind.IDENTIFIER_LIST)) {
                        for (Token member : token.children()) select.add(member.text().trim());
                    } else if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.WILDCARD)
                        || token.is(TokenKind.FUNCTION_CALL)) {
                        select.add(token.text().trim());
                    } else {
                        unresolved(state, token);
                    }
                }
                case FROM -> {
                    if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.KEYWORD)) {
                        from = token.text().trim();
                        state = State.JOIN_OR_CLAUSE;
                    } else {
                        unresolved(state, token);
                    }
                }
                case JOIN_OR_CLAUSE -> {
                    JoinKind kind = token.is(TokenKind.KEYWORD) ? JoinKind.fromKeyword(token.text()) : null;
                    if (kind != null) {
                        joinKind = kind;
                        state = State.JOIN;
                    } else if (token.is(TokenKind.WHERE_CLAUSE)) {
                        state = State.WHERE;
                        consumed = false;
                    } else if (token.isKeyword("ORDER BY")) {
                        state = State.ORDER_BY;
                    } else if (token.isKeyword("GROUP BY")) {
                        state = State.GROUP_BY;
                    } else if (token.isKeyword("LIMIT")) {
                        state = State.LIMIT;
                    } else {
                        unresolved(state, token);
                    }
                }
                case JOIN -> {
                    if (token.is(TokenKind.IDENTIFIER) || (token.is(TokenKind.KEYWORD) && !token.isKeyword("ON"))) {
                        joinTable = token.text().trim();
                        state = State.ON;
                    } else {
                        unresolved(state, token);
                    }
                }
                case ON -> {
                    if (token.is(TokenKind.COMPARISON)) {
                        joins.put(joinTable, joinSpec(joinKind, joinTable, token));
                        joinKind = null;
                        joinTable = null;
                        state = State.JOIN_OR_CLAUSE;
                    } else if (!token.isKeyword("ON")) {
                        unresolved(state, token);
                    }
                }
                case WHERE -> {
                    where = LEADING_WHERE.matcher(token.text()).replaceFirst("").trim();
                    state = State.JOIN_OR_CLAUSE;
                }
                case ORDER_BY -> {
                    orderBy = appendEntries(orderBy, token, state);
                    state = State.JOIN_OR_CLAUSE;
                }
                case GROUP_BY -> {
                    groupBy = appendEntries(groupBy, token, state);
                    state = State.JOIN_OR_CLAUSE;
                }
                case LIMIT -> {
                    if (!token.is(TokenKind.LITERAL_INTEGER)) {
                        throw DbException.planError("LIMIT expects an integer, got '" + token.text() + "'");
                    }
                    try {
                        limit = Integer.parseInt(token.text());
                    } catch (NumberFormatException e) {
                        throw DbException.planError("LIMIT value out of range: " + token.text());
                    }
                    state = State.JOIN_OR_CLAUSE;
                }
            }
            if (consumed) i++;
        }

        switch (state) {
            case START, SELECT_LIST, FROM -> throw DbException.planError("SELECT statement has no FROM table");
            case JOIN -> throw DbException.planError("JOIN without a table name");
            case ON -> throw DbException.planError("JOIN " + joinTable + " has no ON condition");
            case ORDER_BY, GROUP_BY, LIMIT -> throw DbException.planError("Incomplete " + state.name().replace('_', ' ') + " clause");
            default -> { }
        }
        if (select.isEmpty()) throw DbException.planError("SELECT list is empty");
        return new SelectPlan(select, from, joins, where, groupBy, orderBy, limit);
    }

    private static JoinSpec joinSpec(JoinKind kind, String joinTable, Token comparison) {
        List<Token> parts = comparison.children();
        if (parts.size() != 3 || !"=".equals(parts.get(1).text())) {
            throw DbException.planError("Only equality join conditions are supported: " + comparison.text());
        }
        String[] left = qualified(parts.get(0).text());
        String[] right = qualified(parts.get(2).text());
        // the right-hand side must name the joined table
        if (joinTable.equals(left[0]) && !joinTable.equals(right[0])) {
            String[] tmp = left;
            left = right;
            right = tmp;
        }
        return new JoinSpec(kind, left[0], left[1], right[0], right[1]);
    }

    private static String[] qualified(String name) {
        String n = name.trim();
        int dot = n.lastIndexOf('.');
        if (dot < 0) return new String[] { null, n };
        return new String[] { n.substring(0, dot), n.substring(dot + 1) };
    }

    private static List<String> appendEntries(List<String> entries, Token token, State state) {
        List<String> out = entries == null ? new ArrayList<>() : entries;
        if (token.is(TokenKind.IDENTIFIER_LIST)) {
            for (Token member : token.children()) out.add(orderEntry(member.text()));
        } else if (token.is(TokenKind.IDENTIFIER) || token.is(TokenKind.KEYWORD)) {
            out.add(orderEntry(token.text()));
        } else {
            unresolved(state, token);
            return entries;
        }
        return out;
    }

    // "age   desc" -> "age DESC"
    private static String orderEntry(String text) {
        String t = text.trim().replaceAll("\\s+", " ");
        Matcher m = DIRECTION.matcher(t);
        if (m.matches()) return m.group(1) + " " + m.group(2).toUpperCase(Locale.ROOT);
        return t;
    }

    private static void unresolved(State state, Token token) {
        log.debug("[{}] Unresolved token {}", state, token);
    }

    InsertPlan planInsert(List<Token> tokens) {
        String table = null;
        List<String> columns = new ArrayList<>();
        List<List<Object>> values = null;
        boolean expectTable = false;
        for (Token token : tokens) {
            if (token.is(TokenKind.WHITESPACE)) continue;
            if (token.isKeyword("INSERT") || token.isKeyword("INTO")) {
                expectTable = true;
            } else if (token.is(TokenKind.FUNCTION_CALL) && expectTable) {
                String text = token.text().trim();
                int open = text.indexOf('(');
                table = text.substring(0, open).trim();
                String inner = text.substring(open + 1, text.length() - 1);
                for (String c : inner.split(",")) {
                    if (!c.isBlank()) columns.add(c.trim());
                }
                expectTable = false;
            } else if (token.is(TokenKind.IDENTIFIER) && expectTable) {
                table = token.text().trim();
                expectTable = false;
            } else if (token.is(TokenKind.VALUE_LIST)) {
                values = valuesParser.parse(LEADING_VALUES.matcher(token.text()).replaceFirst(""));
            } else {
                log.debug("[INSERT] Unresolved token {}", token);
            }
        }
        if (table == null || table.isEmpty()) {
            throw new DbException(ErrorKind.MALFORMED_INSERT, "INSERT statement names no table");
        }
        if (values == null) {
            throw new DbException(ErrorKind.MALFORMED_INSERT, "INSERT statement has no VALUES list");
        }
        return new InsertPlan(table, columns, values);
    }

    /**
     * Table name: text between {@code CREATE TABLE} and the first {@code (}. Columns: text
     * inside the outermost parentheses, split on top-level commas, each entry split into
     * name and declared type on its first whitespace.
     */
    CreateTablePlan planCreateTable(String text) {
        Matcher name = CREATE_TABLE_NAME.matcher(text);
        if (!name.find()) throw malformedCreate("Invalid CREATE TABLE query: Table name not found");
        int open = text.indexOf('(', name.start());
        int close = text.lastIndexOf(')');
        if (close <= open) throw malformedCreate("Invalid CREATE TABLE query: Columns not found");
        String body = text.substring(open + 1, close).trim();
        if (body.isEmpty()) throw malformedCreate("Invalid CREATE TABLE query: Columns not found");

        Map<String, String> columns = new LinkedHashMap<>();
        for (String entry : splitTopLevel(body)) {
            String e = entry.trim();
            String[] parts = e.split("\\s+", 2);
            if (e.isEmpty() || parts.length < 2) {
                throw malformedCreate("Invalid column definition: '" + e + "'");
            }
            if (columns.putIfAbsent(parts[0], parts[1].trim()) != null) {
                throw malformedCreate("Duplicate column '" + parts[0] + "'");
            }
        }
        String table = name.group(1).trim();
        if (!TABLE_NAME.matcher(table).matches()) {
            throw malformedCreate("Invalid table name: '" + table + "'");
        }
        return new CreateTablePlan(table, columns);
    }

    // VARCHAR(10, 2) style types keep their commas
    private static List<String> splitTopLevel(String body) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') depth++;
            else if (c == ')' && depth > 0) depth--;
            else if (c == ',' && depth == 0) {
                out.add(body.substring(start, i));
                start = i + 1;
            }
        }
        out.add(body.substring(start));
        return out;
    }

    private static DbException malformedCreate(String message) {
        return new DbException(ErrorKind.MALFORMED_CREATE_TABLE, message);
    }
}
