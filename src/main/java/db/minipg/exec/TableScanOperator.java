package db.minipg.exec;

import java.util.Map;

import db.minipg.storage.StorageBackend;

/**
 * Physical operator that streams a table's rows in file order.
 * With a column prefix every emitted column is renamed {@code "<prefix>.<column>"}
 * so rows of different tables can be merged without clashes.
 */
public class TableScanOperator implements Operator {
    private final StorageBackend storage;
    private final String tableName;
    private final String columnPrefix; // null: keep column names as stored

    private StorageBackend.RowCursor cursor;

    public TableScanOperator(StorageBackend storage, String tableName, String columnPrefix) {
        this.storage = storage;
        this.tableName = tableName;
        this.columnPrefix = columnPrefix;
    }

    @Override
    public void open() {
        cursor = storage.scan(tableName);
    }

    @Override
    public Row next() {
        if (cursor == null) return null;
        Map<String, Object> raw = cursor.next();
        if (raw == null) return null;
        return columnPrefix == null ? Row.of(raw) : Row.prefixed(columnPrefix, raw);
    }

    @Override
    public void close() {
        if (cursor != null) {
            cursor.close();
            cursor = null;
        }
    }

    public String tableName() { return tableName; }
}
