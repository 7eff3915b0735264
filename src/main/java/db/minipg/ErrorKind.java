package db.minipg;

/**
 * Failure categories surfaced by the engine. Each maps to one validation point.
 */
public enum ErrorKind {
    UNSUPPORTED_STATEMENT,
    TABLE_NOT_FOUND,
    COLUMN_NOT_FOUND,
    TABLE_ALREADY_EXISTS,
    SEQUENCE_NOT_FOUND,
    AGGREGATE_REQUIRES_GROUP_BY,
    APPEND_ONLY_VIOLATION,
    MALFORMED_CREATE_TABLE,
    MALFORMED_INSERT,
    MALFORMED_PREDICATE,
    PLAN_ERROR,
    PER_TABLE_STATS_FAILURE,
    STORAGE_FAILURE
}
