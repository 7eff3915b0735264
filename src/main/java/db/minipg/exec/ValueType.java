package db.minipg.exec;

import java.util.List;
import java.util.Map;

/**
 * Kinds of scalar a row value can hold. Declared in sort order: values of an earlier
 * kind order before values of a later one.
 */
public enum ValueType {
    NULL,
    BOOLEAN,
    INTEGER,
    FLOAT,
    STRING,
    LIST,
    MAP;

    public static ValueType of(Object v) {
        if (v == null) return NULL;
        if (v instanceof Boolean) return BOOLEAN;
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) return INTEGER;
        if (v instanceof Number) return FLOAT;
        if (v instanceof String) return STRING;
        if (v instanceof List) return LIST;
        if (v instanceof Map) return MAP;
        throw new IllegalArgumentException("Unsupported row value: " + v.getClass().getName());
    }

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    // INTEGER and FLOAT share one rank so numbers interleave by value
    int rank() {
        return switch (this) {
            case NULL -> 0;
            case BOOLEAN -> 1;
            case INTEGER, FLOAT -> 2;
            case STRING -> 3;
            case LIST -> 4;
            case MAP -> 5;
        };
    }
}
