package db.minipg.sql;

import java.util.List;

/**
 * One statement: its command kind, grouped tokens in source order and the raw text.
 */
public record TokenizedStatement(CommandKind command, List<Token> tokens, String text) {
    public TokenizedStatement {
        tokens = List.copyOf(tokens);
    }

    /** First word of the statement, upper-cased, or empty. Used in error messages. */
    public String leadingWord() {
        for (Token t : tokens) {
            if (t.kind() == TokenKind.WHITESPACE) continue;
            String n = t.normalized();
            int sp = n.indexOf(' ');
            return sp < 0 ? n : n.substring(0, sp);
        }
        return "";
    }
}
