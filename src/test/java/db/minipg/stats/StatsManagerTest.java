package db.minipg.stats;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.catalog.CatalogManager;
import db.minipg.storage.DataLayout;
import db.minipg.storage.JsonDocumentStore;
import db.minipg.storage.JsonLinesBackend;

public class StatsManagerTest {
    @TempDir
    Path dir;

    private DataLayout layout;
    private CatalogManager catalog;
    private JsonLinesBackend storage;
    private StatsManager stats;

    @BeforeEach
    void setUp() {
        layout = new DataLayout(dir);
        layout.initialize();
        JsonDocumentStore documents = new JsonDocumentStore(JsonDocumentStore.newGson());
        catalog = new CatalogManager(documents, layout.catalogFile());
        storage = new JsonLinesBackend(layout, documents.gson());
        stats = new StatsManager(catalog, storage, documents, layout, 2);
    }

    private void table(String name, List<Map<String, Object>> rows) {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("name", "TEXT");
        columns.put("age", "INT");
        catalog.createTable(name, columns);
        storage.createTable(name);
        storage.append(name, rows);
    }

    private static Map<String, Object> row(long id, String name, Object age) {
        Map<String, Object> m = new HashMap<>();
        m.put("id", id);
        m.put("name", name);
        m.put("age", age);
        return m;
    }

    @Test
    void columnStatisticsSkipNulls() {
        table("users", Arrays.asList(row(1, "John", 50L), row(2, "Jane", null), row(3, "John", 40L)));

        TableStatistics s = stats.updateTableStats("users");
        assertEquals(3, s.rowCount());
        assertEquals(List.of("name", "age"), List.copyOf(s.columnStats().keySet()));

        ColumnStatistics age = s.column("age");
        assertEquals(2, age.count());
        assertEquals(40L, age.min());
        assertEquals(50L, age.max());
        assertEquals(List.of("50", "40"), List.copyOf(age.valFreq().keySet()));
        assertEquals(0, age.frequency("null"));

        ColumnStatistics name = s.column("name");
        assertEquals(3, name.count());
        assertEquals("Jane", name.min());
        assertEquals("John", name.max());
        assertEquals("John", name.mode());
        assertEquals(2, name.frequency("John"));
    }

    @Test
    void emptyTableHasEmptyColumns() {
        table("empty", List.of());
        TableStatistics s = stats.updateTableStats("empty");
        assertEquals(0, s.rowCount());
        assertEquals(0, s.column("age").count());
        assertNull(s.column("age").min());
        assertNull(s.column("age").mode());
    }

    @Test
    void persistedDocumentIsStable() {
        table("users", List.of(row(1, "John", 50L), row(2, "Jane", 51L)));
        stats.updateTableStats("users");
        String first = stats.getTableStatsDocument("users");
        stats.updateTableStats("users");
        assertEquals(first, stats.getTableStatsDocument("users"));
        assertTrue(first.contains("\"row_count\":2"));
        assertTrue(first.contains("\"val_freq\""));

        TableStatistics read = stats.getTableStats("users");
        assertEquals(2, read.rowCount());
        assertEquals(51L, read.column("age").max());
    }

    @Test
    void lookupErrors() {
        assertEquals(ErrorKind.TABLE_NOT_FOUND,
            assertThrows(DbException.class, () -> stats.getTableStats("ghost")).kind());
        assertEquals(ErrorKind.TABLE_NOT_FOUND,
            assertThrows(DbException.class, () -> stats.updateTableStats("ghost")).kind());

        table("users", List.of());
        assertEquals(ErrorKind.PER_TABLE_STATS_FAILURE,
            assertThrows(DbException.class, () -> stats.getTableStats("users")).kind());
    }

    @Test
    void bulkRefreshIsolatesFailures() throws Exception {
        table("a", List.of(row(1, "x", 1L)));
        table("b", List.of(row(1, "y", 2L)));
        table("c", List.of());
        Files.delete(layout.tableFile("b"));

        StatsRefreshReport report = stats.updateAllTableStats();
        assertFalse(report.isSuccess());
        assertEquals(List.of("a", "c"), report.updated());
        assertEquals(List.of("b"), List.copyOf(report.failures().keySet()));
        assertEquals(1, stats.getTableStats("a").rowCount());
    }

    @Test
    void bulkRefreshWithNoTables() {
        StatsRefreshReport report = stats.updateAllTableStats();
        assertTrue(report.isSuccess());
        assertTrue(report.updated().isEmpty());
    }

    @Test
    void histogramMergesIntegralFloats() {
        table("scores", List.of(row(1, "a", 50L), row(2, "b", 50.0), row(3, "c", 7.5)));
        ColumnStatistics age = stats.updateTableStats("scores").column("age");
        assertEquals(List.of("50", "7.5"), List.copyOf(age.valFreq().keySet()));
        assertEquals(2, age.frequency("50"));
        assertEquals(50L, age.mode());
    }
}
