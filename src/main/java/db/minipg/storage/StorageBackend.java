package db.minipg.storage;

import java.util.List;
import java.util.Map;

/**
 * Physical row storage for one table format. Rows are flat column-name to value maps.
 * Only line-delimited JSON is implemented; CSV or columnar formats would plug in here.
 */
public interface StorageBackend {

    /** Create (or truncate) the empty storage file for a table. */
    void createTable(String table);

    /** Append rows at the end of the table, in order. */
    void append(String table, List<Map<String, Object>> rows);

    /** Iterate the table in file order. Callers must close the cursor. */
    RowCursor scan(String table);

    /** Load the whole table in file order. */
    List<Map<String, Object>> readAll(String table);

    /** Forward-only row iterator over a storage file. */
    interface RowCursor extends AutoCloseable {
        Map<String, Object> next(); // null when exhausted

        @Override
        void close();
    }
}
