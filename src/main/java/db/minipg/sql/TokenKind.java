package db.minipg.sql;

/**
 * Classification of grouped tokens handed to the plan compiler.
 */
public enum TokenKind {
    KEYWORD,
    IDENTIFIER,
    IDENTIFIER_LIST,
    WHERE_CLAUSE,
    FUNCTION_CALL,
    VALUE_LIST,
    COMPARISON,
    LITERAL_INTEGER,
    LITERAL_FLOAT,
    LITERAL_STRING,
    WILDCARD,
    PUNCTUATION,
    WHITESPACE
}
