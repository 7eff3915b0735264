package db.minipg;

/**
 * Typed engine failure. Thrown from the validation point that detected it and
 * flattened into an "Error: ..." status message by {@link MiniPgEngine#runQuery(String)}.
 */
public class DbException extends RuntimeException {
    private final ErrorKind kind;

    public DbException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DbException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }

    public static DbException unsupported(String what) {
        return new DbException(ErrorKind.UNSUPPORTED_STATEMENT, "Unsupported query type: " + what);
    }

    public static DbException tableNotFound(String table) {
        return new DbException(ErrorKind.TABLE_NOT_FOUND, "Table '" + table + "' not found in catalog");
    }

    public static DbException columnNotFound(String column, String table) {
        return new DbException(ErrorKind.COLUMN_NOT_FOUND, "Column '" + column + "' not found in table '" + table + "'");
    }

    public static DbException tableExists(String table) {
        return new DbException(ErrorKind.TABLE_ALREADY_EXISTS, "Table '" + table + "' already exists");
    }

    public static DbException sequenceNotFound(String sequence) {
        return new DbException(ErrorKind.SEQUENCE_NOT_FOUND, "Sequence '" + sequence + "' not found");
    }

    public static DbException planError(String message) {
        return new DbException(ErrorKind.PLAN_ERROR, message);
    }

    public static DbException storage(String message, Throwable cause) {
        return new DbException(ErrorKind.STORAGE_FAILURE, message, cause);
    }
}
