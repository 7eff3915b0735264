package db.minipg.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import db.minipg.DbException;

/**
 * Splits one SQL statement into grouped tokens.
 *
 * Lexing produces words, literals and punctuation; grouping then folds them into the shapes
 * the plan compiler works with:
 * <ul>
 *   <li>multi-word keywords ({@code ORDER BY}, {@code GROUP BY}, {@code LEFT OUTER JOIN}, ...);</li>
 *   <li>a WHERE clause up to the next top-level {@code ORDER BY}, {@code GROUP BY}, {@code LIMIT} or {@code ;};</li>
 *   <li>a VALUES list up to {@code ;} or the end of input;</li>
 *   <li>function calls ({@code COUNT(*)}, and {@code INTO t (a, b)});</li>
 *   <li>identifiers with a trailing {@code ASC}/{@code DESC};</li>
 *   <li>comparisons {@code left op right} and comma-separated identifier lists.</li>
 * </ul>
 */
public class SqlTokenizer {

    private static final Set<String> KEYWORDS = Set.of(
        "SELECT", "INSERT", "CREATE", "FROM", "WHERE", "JOIN", "INNER", "LEFT", "RIGHT", "FULL",
        "OUTER", "ON", "ORDER", "GROUP", "BY", "LIMIT", "INTO", "VALUES", "TABLE", "AND", "OR",
        "NOT", "ASC", "DESC", "AS");

    private enum LexKind { SPACE, WORD, QUOTED, QUOTED_IDENT, NUMBER, COMPARATOR, LPAREN, RPAREN, COMMA, SEMICOLON, STAR, OTHER }

    private record Lexeme(LexKind kind, String text, int start, int end) {
        boolean isWord(String upper) {
            return kind == LexKind.WORD && text.equalsIgnoreCase(upper);
        }
        boolean isKeyword() {
            return kind == LexKind.WORD && KEYWORDS.contains(text.toUpperCase(Locale.ROOT));
        }
    }

    private record Grouped(Token token, int start, int end, int next) {}

    public TokenizedStatement tokenize(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        List<Token> tokens = new Grouper(sql, lex(sql)).group();
        CommandKind command = CommandKind.UNSUPPORTED;
        for (Token t : tokens) {
            if (t.kind() == TokenKind.WHITESPACE) continue;
            if (t.kind() == TokenKind.KEYWORD) command = CommandKind.fromKeyword(t.normalized());
            break;
        }
        return new TokenizedStatement(command, tokens, sql);
    }

    private static List<Lexeme> lex(String s) {
        List<Lexeme> out = new ArrayList<>();
        int n = s.length();
        int i = 0;
        while (i < n) {
            char c = s.charAt(i);
            int start = i;
            LexKind kind;
            if (Character.isWhitespace(c)) {
                while (i < n && Character.isWhitespace(s.charAt(i))) i++;
                kind = LexKind.SPACE;
            } else if (c == '-' && i + 1 < n && s.charAt(i + 1) == '-') {
                while (i < n && s.charAt(i) != '\n') i++;
                kind = LexKind.SPACE;
            } else if (c == '\'') {
                i = endOfQuoted(s, i, '\'');
                kind = LexKind.QUOTED;
            } else if (c == '"') {
                i = endOfQuoted(s, i, '"');
                kind = LexKind.QUOTED_IDENT;
            } else if (Character.isLetter(c) || c == '_') {
                while (i < n && isWordChar(s.charAt(i))) i++;
                if (s.charAt(i - 1) == '.' && i < n && s.charAt(i) == '*') i++;
                kind = LexKind.WORD;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(s.charAt(i + 1)))) {
                i = endOfNumber(s, i);
                kind = LexKind.NUMBER;
            } else if (c == '<' || c == '>' || c == '=' || c == '!') {
                i++;
                if (i < n && (s.charAt(i) == '=' || (c == '<' && s.charAt(i) == '>'))) i++;
                kind = (i - start == 1 && c == '!') ? LexKind.OTHER : LexKind.COMPARATOR;
            } else {
                i++;
                kind = switch (c) {
                    case '(' -> LexKind.LPAREN;
                    case ')' -> LexKind.RPAREN;
                    case ',' -> LexKind.COMMA;
                    case ';' -> LexKind.SEMICOLON;
                    case '*' -> LexKind.STAR;
                    default -> LexKind.OTHER;
                };
            }
            out.add(new Lexeme(kind, s.substring(start, i), start, i));
        }
        return out;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    // Returns the index just past the closing quote; a doubled quote is an escaped quote.
    private static int endOfQuoted(String s, int open, char quote) {
        int i = open + 1;
        while (i < s.length()) {
            if (s.charAt(i) == quote) {
                if (i + 1 < s.length() && s.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw DbException.planError("Unterminated quoted literal starting at position " + open);
    }

    private static int endOfNumber(String s, int i) {
        int n = s.length();
        while (i < n && Character.isDigit(s.charAt(i))) i++;
        if (i < n && s.charAt(i) == '.') {
            i++;
            while (i < n && Character.isDigit(s.charAt(i))) i++;
        }
        if (i < n && (s.charAt(i) == 'e' || s.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < n && (s.charAt(j) == '+' || s.charAt(j) == '-')) j++;
            if (j < n && Character.isDigit(s.charAt(j))) {
                i = j;
                while (i < n && Character.isDigit(s.charAt(i))) i++;
            }
        }
        return i;
    }

    private static final class Grouper {
        private final String sql;
        private final List<Lexeme> lex;
        private final List<Token> out = new ArrayList<>();
        private int pos;
        private boolean afterInto;

        Grouper(String sql, List<Lexeme> lex) {
            this.sql = sql;
            this.lex = lex;
        }

        List<Token> group() {
            while (pos < lex.size()) {
                Lexeme lx = lex.get(pos);
                switch (lx.kind()) {
                    case SPACE -> {
                        out.add(new Token(TokenKind.WHITESPACE, lx.text()));
                        pos++;
                    }
                    case WORD -> word(lx);
                    case STAR, NUMBER, QUOTED, QUOTED_IDENT -> {
                        afterInto = false;
                        item(false);
                    }
                    default -> {
                        afterInto = false;
                        out.add(new Token(TokenKind.PUNCTUATION, lx.text()));
                        pos++;
                    }
                }
            }
            return out;
        }

        private void word(Lexeme lx) {
            if (afterInto) {
                afterInto = false;
                item(true);
                return;
            }
            if (!lx.isKeyword()) {
                item(false);
                return;
            }
            String upper = lx.text().toUpperCase(Locale.ROOT);
            switch (upper) {
                case "WHERE" -> clause(TokenKind.WHERE_CLAUSE, true);
                case "VALUES" -> clause(TokenKind.VALUE_LIST, false);
                case "ORDER", "GROUP" -> {
                    int by = nextSignificant(pos + 1);
                    keyword(by >= 0 && lex.get(by).isWord("BY") ? by : pos);
                }
                case "INNER", "LEFT", "RIGHT", "FULL" -> {
                    int k = nextSignificant(pos + 1);
                    if (k >= 0 && lex.get(k).isWord("OUTER")) k = nextSignificant(k + 1);
                    keyword(k >= 0 && lex.get(k).isWord("JOIN") ? k : pos);
                }
                case "INTO" -> {
                    keyword(pos);
                    afterInto = true;
                }
                default -> keyword(pos);
            }
        }

        private void keyword(int lastIndex) {
            int start = lex.get(pos).start();
            out.add(new Token(TokenKind.KEYWORD, sql.substring(start, lex.get(lastIndex).end())));
            pos = lastIndex + 1;
        }

        // WHERE runs to a top-level ORDER BY / GROUP BY / LIMIT; VALUES runs to ';' or the end.
        private void clause(TokenKind kind, boolean stopAtClauses) {
            int start = lex.get(pos).start();
            int lastEnd = lex.get(pos).end();
            int depth = 0;
            int j = pos + 1;
            while (j < lex.size()) {
                Lexeme l = lex.get(j);
                if (depth == 0) {
                    if (l.kind() == LexKind.SEMICOLON) break;
                    if (stopAtClauses && endsWhere(j)) break;
                }
                if (l.kind() == LexKind.LPAREN) depth++;
                if (l.kind() == LexKind.RPAREN && depth > 0) depth--;
                if (l.kind() != LexKind.SPACE) lastEnd = l.end();
                j++;
            }
            out.add(new Token(kind, sql.substring(start, lastEnd)));
            pos = j;
        }

        private boolean endsWhere(int j) {
            Lexeme l = lex.get(j);
            if (l.isWord("LIMIT")) return true;
            if (l.isWord("ORDER") || l.isWord("GROUP")) {
                int by = nextSignificant(j + 1);
                return by >= 0 && lex.get(by).isWord("BY");
            }
            return false;
        }

        private void item(boolean intoTarget) {
            Grouped first = single(pos, intoTarget);
            if (first == null) {
                Lexeme lx = lex.get(pos);
                out.add(new Token(lx.isKeyword() ? TokenKind.KEYWORD : TokenKind.PUNCTUATION, lx.text()));
                pos++;
                return;
            }
            int k = nextSignificant(first.next());
            if (k >= 0 && lex.get(k).kind() == LexKind.COMPARATOR && isOperand(first.token())) {
                int r = nextSignificant(k + 1);
                Grouped right = r >= 0 ? single(r, false) : null;
                if (right != null && isOperand(right.token())) {
                    Token op = new Token(TokenKind.PUNCTUATION, lex.get(k).text());
                    out.add(new Token(TokenKind.COMPARISON, sql.substring(first.start(), right.end()),
                        List.of(first.token(), op, right.token())));
                    pos = right.next();
                    return;
                }
            }
            if (k >= 0 && lex.get(k).kind() == LexKind.COMMA && !intoTarget) {
                List<Token> members = new ArrayList<>();
                members.add(first.token());
                int end = first.end();
                int next = first.next();
                while (true) {
                    int comma = nextSignificant(next);
                    if (comma < 0 || lex.get(comma).kind() != LexKind.COMMA) break;
                    int s = nextSignificant(comma + 1);
                    Grouped g = s >= 0 ? single(s, false) : null;
                    if (g == null) break;
                    members.add(g.token());
                    end = g.end();
                    next = g.next();
                }
                if (members.size() > 1) {
                    out.add(new Token(TokenKind.IDENTIFIER_LIST, sql.substring(first.start(), end), members));
                    pos = next;
                    return;
                }
            }
            out.add(first.token());
            pos = first.next();
        }

        private Grouped single(int idx, boolean intoTarget) {
            Lexeme l = lex.get(idx);
            switch (l.kind()) {
                case WORD -> {
                    if (l.isKeyword() && !intoTarget) return null;
                    int paren = -1;
                    if (idx + 1 < lex.size() && lex.get(idx + 1).kind() == LexKind.LPAREN) {
                        paren = idx + 1;
                    } else if (intoTarget) {
                        int k = nextSignificant(idx + 1);
                        if (k >= 0 && lex.get(k).kind() == LexKind.LPAREN) paren = k;
                    }
                    if (paren >= 0) {
                        int close = matchingParen(paren);
                        if (close >= 0) {
                            int end = lex.get(close).end();
                            return new Grouped(new Token(TokenKind.FUNCTION_CALL, sql.substring(l.start(), end)),
                                l.start(), end, close + 1);
                        }
                    }
                    return identifier(idx);
                }
                case QUOTED_IDENT -> {
                    return identifier(idx);
                }
                case STAR -> {
                    return new Grouped(new Token(TokenKind.WILDCARD, l.text()), l.start(), l.end(), idx + 1);
                }
                case NUMBER -> {
                    boolean integral = l.text().chars().allMatch(Character::isDigit);
                    TokenKind kind = integral ? TokenKind.LITERAL_INTEGER : TokenKind.LITERAL_FLOAT;
                    return new Grouped(new Token(kind, l.text()), l.start(), l.end(), idx + 1);
                }
                case QUOTED -> {
                    return new Grouped(new Token(TokenKind.LITERAL_STRING, l.text()), l.start(), l.end(), idx + 1);
                }
                default -> {
                    return null;
                }
            }
        }

        private Grouped identifier(int idx) {
            Lexeme l = lex.get(idx);
            int d = nextSignificant(idx + 1);
            if (d >= 0 && (lex.get(d).isWord("ASC") || lex.get(d).isWord("DESC"))) {
                int end = lex.get(d).end();
                return new Grouped(new Token(TokenKind.IDENTIFIER, sql.substring(l.start(), end)), l.start(), end, d + 1);
            }
            return new Grouped(new Token(TokenKind.IDENTIFIER, l.text()), l.start(), l.end(), idx + 1);
        }

        private boolean isOperand(Token t) {
            return switch (t.kind()) {
                case IDENTIFIER, LITERAL_INTEGER, LITERAL_FLOAT, LITERAL_STRING -> true;
                default -> false;
            };
        }

        private int matchingParen(int open) {
            int depth = 0;
            for (int j = open; j < lex.size(); j++) {
                LexKind k = lex.get(j).kind();
                if (k == LexKind.LPAREN) depth++;
                if (k == LexKind.RPAREN && --depth == 0) return j;
            }
            return -1;
        }

        private int nextSignificant(int from) {
            for (int j = from; j < lex.size(); j++) {
                if (lex.get(j).kind() != LexKind.SPACE) return j;
            }
            return -1;
        }
    }
}
