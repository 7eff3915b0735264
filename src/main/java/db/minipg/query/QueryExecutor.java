package db.minipg.query;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.catalog.CatalogManager;
import db.minipg.catalog.TableSchema;
import db.minipg.exec.Operator;
import db.minipg.exec.Row;
import db.minipg.seq.SequenceManager;
import db.minipg.stats.StatsManager;
import db.minipg.storage.StorageBackend;
import db.minipg.worker.BackgroundWorkerPool;

/**
 * Executes compiled plans against the catalog, storage, sequences and statistics.
 */
public class QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final CatalogManager catalog;
    private final StorageBackend storage;
    private final SequenceManager sequences;
    private final StatsManager stats;
    private final BackgroundWorkerPool pool;
    private final SelectPlanner selectPlanner;
    private final boolean statsOnInsert;

    public QueryExecutor(CatalogManager catalog, StorageBackend storage, SequenceManager sequences,
                         StatsManager stats, BackgroundWorkerPool pool, boolean statsOnInsert) {
        this.catalog = catalog;
        this.storage = storage;
        this.sequences = sequences;
        this.stats = stats;
        this.pool = pool;
        this.statsOnInsert = statsOnInsert;
        this.selectPlanner = new SelectPlanner(catalog, storage, new PredicateCompiler());
    }

    public QueryResult execute(Plan plan) {
        if (plan instanceof SelectPlan select) return executeSelect(select);
        if (plan instanceof InsertPlan insert) return executeInsert(insert);
        if (plan instanceof CreateTablePlan create) return executeCreateTable(create);
        throw DbException.unsupported(plan == null ? "UNKNOWN" : plan.getClass().getSimpleName());
    }

    public QueryResult executeSelect(SelectPlan plan) {
        Operator root = selectPlanner.plan(plan);
        List<Map<String, Object>> rows = new ArrayList<>();
        try {
            for (Row r : stream(root)) rows.add(new LinkedHashMap<>(r.values()));
        } finally {
            root.close();
        }
        return new QueryResult("Query OK, " + rows.size() + " rows returned", rows);
    }

    /**
     * Streaming interface: returns an Iterable that opens the operator on first iteration
     * and closes it when exhausted.
     * This pulls rows one at a time and avoids building a large intermediate list.
     */
    public Iterable<Row> stream(Operator op) {
        return () -> new Iterator<Row>() {
            private boolean opened = false;
            private Row next = null;
            private boolean finished = false;

            private void ensureOpen() {
                if (!opened) {
                    op.open();
                    opened = true;
                    advance();
                }
            }

            private void advance() {
                if (finished) return;
                next = op.next();
                if (next == null) {
                    finished = true;
                    op.close();
                }
            }

            @Override
            public boolean hasNext() {
                ensureOpen();
                return !finished;
            }

            @Override
            public Row next() {
                if (!hasNext()) throw new NoSuchElementException();
                Row current = next;
                advance();
                return current;
            }
        };
    }

    /**
     * Append the plan's tuples, each prefixed with the next {@code <table>_id_seq} value.
     * Everything is validated before the first id is taken, so a rejected statement
     * leaves no gap in the sequence.
     */
    public QueryResult executeInsert(InsertPlan plan) {
        String table = plan.table();
        TableSchema schema = catalog.getTableSchema(table);
        if (schema == null) throw DbException.tableNotFound(table);
        if (!schema.isAppendOnly()) {
            throw new DbException(ErrorKind.APPEND_ONLY_VIOLATION,
                "Table '" + table + "' is not append-only (sort: " + schema.sort() + "); INSERT requires sort '"
                    + TableSchema.APPEND_ONLY_SORT + "'");
        }
        List<String> columns = insertColumns(plan, schema);
        for (List<Object> tuple : plan.values()) {
            if (tuple.size() != columns.size()) {
                throw new DbException(ErrorKind.MALFORMED_INSERT,
                    "Expected " + columns.size() + " values per row but got " + tuple.size());
            }
        }

        List<Map<String, Object>> records = new ArrayList<>(plan.values().size());
        for (List<Object> tuple : plan.values()) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put(TableSchema.ID_COLUMN, sequences.nextValue(schema.sequenceName()));
            for (int i = 0; i < columns.size(); i++) record.put(columns.get(i), tuple.get(i));
            records.add(record);
        }
        storage.append(table, records);
        if (statsOnInsert) scheduleStatsRefresh(table);
        return new QueryResult("Inserted " + records.size() + " records into table '" + table + "'", List.of());
    }

    private static List<String> insertColumns(InsertPlan plan, TableSchema schema) {
        if (plan.columns().isEmpty()) {
            List<String> declared = new ArrayList<>(schema.columns().keySet());
            declared.remove(TableSchema.ID_COLUMN);
            return declared;
        }
        Set<String> seen = new HashSet<>();
        for (String column : plan.columns()) {
            if (TableSchema.ID_COLUMN.equals(column)) {
                throw new DbException(ErrorKind.MALFORMED_INSERT,
                    "Column 'id' is assigned from sequence '" + schema.sequenceName() + "'");
            }
            if (!schema.columns().containsKey(column)) throw DbException.columnNotFound(column, schema.name());
            if (!seen.add(column)) throw new DbException(ErrorKind.MALFORMED_INSERT, "Column '" + column + "' listed twice");
        }
        return plan.columns();
    }

    private void scheduleStatsRefresh(String table) {
        try {
            pool.submit("stats " + table, () -> stats.updateTableStats(table));
        } catch (IllegalStateException e) {
            log.debug("Skipping stats refresh for {}: {}", table, e.getMessage());
        }
    }

    /** Register the schema, create the empty table file and its id sequence, compute initial stats. */
    public QueryResult executeCreateTable(CreateTablePlan plan) {
        String table = plan.table();
        catalog.createTable(table, plan.columns());
        storage.createTable(table);
        sequences.register(TableSchema.sequenceNameFor(table));
        stats.updateTableStats(table);
        log.info("Table {} created with columns {}", table, plan.columns().keySet());
        return new QueryResult("Table '" + table + "' created successfully", List.of());
    }
}
