package db.minipg.sql;

import java.util.List;
import java.util.Locale;

/**
 * A grouped token. {@code text} is the exact source text the token covers; composite
 * tokens (identifier lists, comparisons) expose their parts as {@code children}.
 */
public record Token(TokenKind kind, String text, List<Token> children) {

    public Token {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public Token(TokenKind kind, String text) {
        this(kind, text, List.of());
    }

    /** Upper-cased text with runs of whitespace collapsed, e.g. {@code "ORDER BY"}. */
    public String normalized() {
        return text.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && normalized().equals(keyword);
    }

    @Override
    public String toString() {
        return kind + "[" + text + "]";
    }
}
