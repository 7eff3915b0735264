package db.minipg.stats;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.catalog.CatalogManager;
import db.minipg.catalog.TableSchema;
import db.minipg.exec.Values;
import db.minipg.storage.DataLayout;
import db.minipg.storage.JsonDocumentStore;
import db.minipg.storage.StorageBackend;

/**
 * Computes and persists per-table statistics ({@code mpg_stat/<table>.json}).
 *
 * Each refresh is a full scan of the table's declared columns; null and missing values
 * are left out of min, max, count and the histogram. A bulk refresh runs one task per
 * table on a short-lived pool of {@code maxWorkers} threads and reports failed tables
 * without failing the others.
 */
public class StatsManager {
    private static final Logger log = LoggerFactory.getLogger(StatsManager.class);

    private final CatalogManager catalog;
    private final StorageBackend storage;
    private final JsonDocumentStore documents;
    private final DataLayout layout;
    private final int maxWorkers;

    public StatsManager(CatalogManager catalog, StorageBackend storage, JsonDocumentStore documents,
                        DataLayout layout, int maxWorkers) {
        if (maxWorkers < 1) throw new IllegalArgumentException("maxWorkers must be >= 1");
        this.catalog = catalog;
        this.storage = storage;
        this.documents = documents;
        this.layout = layout;
        this.maxWorkers = maxWorkers;
    }

    /**
     * Recompute the table's statistics and overwrite its document.
     *
     * @throws DbException TABLE_NOT_FOUND if the table is not in the catalog
     */
    public TableStatistics updateTableStats(String table) {
        TableSchema schema = catalog.getTableSchema(table);
        if (schema == null) throw DbException.tableNotFound(table);

        Map<String, ColumnAccumulator> columns = new LinkedHashMap<>();
        for (String column : schema.columns().keySet()) columns.put(column, new ColumnAccumulator());
        long rowCount = 0;
        try (StorageBackend.RowCursor cursor = storage.scan(table)) {
            Map<String, Object> row;
            while ((row = cursor.next()) != null) {
                rowCount++;
                for (Map.Entry<String, ColumnAccumulator> e : columns.entrySet()) {
                    e.getValue().add(row.get(e.getKey()));
                }
            }
        }

        Map<String, ColumnStatistics> columnStats = new LinkedHashMap<>();
        columns.forEach((name, acc) -> columnStats.put(name, acc.toStatistics()));
        TableStatistics stats = new TableStatistics(rowCount, columnStats);
        documents.write(layout.statsFile(table), stats);
        log.debug("Updated stats for table {}: {} rows", table, rowCount);
        return stats;
    }

    /** Refresh every catalog table in parallel. Never throws for a single table's failure. */
    public StatsRefreshReport updateAllTableStats() {
        List<String> tables = catalog.tableNames();
        if (tables.isEmpty()) return new StatsRefreshReport(List.of(), Map.of());

        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxWorkers, tables.size()), r -> {
            Thread t = new Thread(r);
            t.setName("minipg-stats-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        Map<String, Future<TableStatistics>> futures = new LinkedHashMap<>();
        List<String> updated = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();
        try {
            for (String table : tables) futures.put(table, executor.submit(() -> updateTableStats(table)));
            for (Map.Entry<String, Future<TableStatistics>> e : futures.entrySet()) {
                String table = e.getKey();
                try {
                    e.getValue().get();
                    updated.add(table);
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    log.warn("Error updating stats for table {}: {}", table, cause.getMessage(), cause);
                    failures.put(table, describe(cause));
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    failures.put(table, "interrupted");
                }
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
            } catch (InterruptedException ex) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Stats refresh: {} table(s) updated, {} failed", updated.size(), failures.size());
        return new StatsRefreshReport(updated, failures);
    }

    /**
     * @throws DbException TABLE_NOT_FOUND for an unknown table, PER_TABLE_STATS_FAILURE when
     *                     no statistics were recorded yet
     */
    public TableStatistics getTableStats(String table) {
        return documents.read(requireStatsFile(table), TableStatistics.class);
    }

    /** The persisted statistics document exactly as stored. */
    public String getTableStatsDocument(String table) {
        return documents.readRaw(requireStatsFile(table));
    }

    private Path requireStatsFile(String table) {
        if (!catalog.exists(table)) throw DbException.tableNotFound(table);
        Path file = layout.statsFile(table);
        if (!Files.exists(file)) {
            throw new DbException(ErrorKind.PER_TABLE_STATS_FAILURE, "No statistics recorded for table '" + table + "'");
        }
        return file;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    private static final class ColumnAccumulator {
        private Object min;
        private Object max;
        private long count;
        private final Map<String, Long> freq = new LinkedHashMap<>();
        private final Map<String, Object> firstValue = new LinkedHashMap<>();

        void add(Object v) {
            if (v == null) return;
            if (min == null || Values.compare(v, min) < 0) min = v;
            if (max == null || Values.compare(v, max) > 0) max = v;
            count++;
            String key = Values.toKeyString(v);
            freq.merge(key, 1L, Long::sum);
            firstValue.putIfAbsent(key, v);
        }

        ColumnStatistics toStatistics() {
            String modeKey = null;
            long best = 0;
            for (Map.Entry<String, Long> e : freq.entrySet()) {
                if (e.getValue() > best) {
                    best = e.getValue();
                    modeKey = e.getKey();
                }
            }
            return new ColumnStatistics(min, max, count, modeKey == null ? null : firstValue.get(modeKey), freq);
        }
    }
}
