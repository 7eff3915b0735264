package db.minipg.sql;

import java.util.Locale;

/**
 * Statement type, taken from the statement's first keyword.
 */
public enum CommandKind {
    SELECT, INSERT, CREATE, UNSUPPORTED;

    public static CommandKind fromKeyword(String keyword) {
        if (keyword == null) return UNSUPPORTED;
        return switch (keyword.toUpperCase(Locale.ROOT)) {
            case "SELECT" -> SELECT;
            case "INSERT" -> INSERT;
            case "CREATE" -> CREATE;
            default -> UNSUPPORTED;
        };
    }
}
