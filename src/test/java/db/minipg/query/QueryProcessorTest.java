package db.minipg.query;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.catalog.CatalogManager;
import db.minipg.seq.SequenceManager;
import db.minipg.stats.StatsManager;
import db.minipg.storage.DataLayout;
import db.minipg.storage.JsonDocumentStore;
import db.minipg.storage.JsonLinesBackend;
import db.minipg.worker.BackgroundWorkerPool;

public class QueryProcessorTest {
    @TempDir
    Path dir;

    private DataLayout layout;
    private BackgroundWorkerPool pool;
    private SequenceManager sequences;
    private QueryProcessor qp;

    @BeforeEach
    void setUp() {
        layout = new DataLayout(dir);
        layout.initialize();
        JsonDocumentStore documents = new JsonDocumentStore(JsonDocumentStore.newGson());
        pool = new BackgroundWorkerPool(2, 16);
        CatalogManager catalog = new CatalogManager(documents, layout.catalogFile());
        JsonLinesBackend storage = new JsonLinesBackend(layout, documents.gson());
        sequences = new SequenceManager(documents, layout.sequencesFile(), pool, 10);
        StatsManager stats = new StatsManager(catalog, storage, documents, layout, 2);
        qp = new QueryProcessor(new QueryExecutor(catalog, storage, sequences, stats, pool, true));

        qp.execute("CREATE TABLE users (name TEXT, age INT)");
        qp.execute("CREATE TABLE orders (user_id INT, total FLOAT)");
        qp.execute("INSERT INTO users (name, age) VALUES ('John', 50), ('Jane', 51), ('Ann', 50)");
        qp.execute("INSERT INTO orders (user_id, total) VALUES (1, 12.5), (1, 7.5), (2, 30.0)");
    }

    @AfterEach
    void tearDown() {
        pool.close();
    }

    private List<Map<String, Object>> rows(String sql) {
        QueryResult r = qp.execute(sql);
        assertFalse(r.isError(), r.message());
        return r.rows();
    }

    private ErrorKind failure(String sql) {
        return assertThrows(DbException.class, () -> qp.execute(sql)).kind();
    }

    @Test
    void statusMessages() {
        assertEquals("Inserted 1 records into table 'users'",
            qp.execute("INSERT INTO users VALUES ('Bob', 20)").message());
        assertEquals("Query OK, 4 rows returned", qp.execute("SELECT * FROM users").message());
        assertEquals("Table 'things' created successfully", qp.execute("CREATE TABLE things (x INT)").message());
    }

    @Test
    void insertAssignsIdsInOrder() {
        List<Map<String, Object>> users = rows("SELECT * FROM users");
        assertEquals(List.of(1L, 2L, 3L), users.stream().map(r -> r.get("id")).toList());
        assertEquals(List.of("id", "name", "age"), List.copyOf(users.get(0).keySet()));
    }

    @Test
    void projectionAndQualifiedColumns() {
        assertEquals(List.of(Map.of("users.name", "Jane")), rows("SELECT users.name FROM users WHERE age > 50"));
        assertEquals(List.of(Map.of("name", "John"), Map.of("name", "Ann")),
            rows("SELECT name FROM users WHERE age = 50"));
    }

    @Test
    void innerJoinMergesPrefixedRows() {
        List<Map<String, Object>> r = rows(
            "SELECT users.name, orders.total FROM users JOIN orders ON users.id = orders.user_id ORDER BY orders.total DESC");
        assertEquals(3, r.size());
        assertEquals(Map.of("users.name", "Jane", "orders.total", 30.0), r.get(0));
        assertEquals(Map.of("users.name", "John", "orders.total", 12.5), r.get(1));
        assertEquals(Map.of("users.name", "John", "orders.total", 7.5), r.get(2));
    }

    @Test
    void joinWithWhereOnUnqualifiedColumn() {
        List<Map<String, Object>> r = rows(
            "SELECT users.name FROM users JOIN orders ON users.id = orders.user_id WHERE total > 10");
        assertEquals(List.of(Map.of("users.name", "John"), Map.of("users.name", "Jane")), r);
    }

    @Test
    void groupByWithAggregates() {
        List<Map<String, Object>> r = rows("SELECT age, COUNT(*), MIN(name) FROM users GROUP BY age");
        assertEquals(2, r.size());
        assertEquals(50L, r.get(0).get("age"));
        assertEquals(2L, r.get(0).get("COUNT(*)"));
        assertEquals("Ann", r.get(0).get("MIN(name)"));
        assertEquals(51L, r.get(1).get("age"));
        assertEquals(1L, r.get(1).get("COUNT(*)"));
    }

    @Test
    void groupByAppliesWhereInsideGroups() {
        List<Map<String, Object>> r = rows("SELECT age, COUNT(*) FROM users WHERE name = 'Jane' GROUP BY age");
        assertEquals(List.of(Map.of("age", 51L, "COUNT(*)", 1L)), r);
    }

    @Test
    void ungroupedAggregates() {
        assertEquals(List.of(Map.of("COUNT(*)", 3L)), rows("SELECT COUNT(*) FROM users"));
        assertEquals(List.of(Map.of("SUM(age)", 151L)), rows("SELECT SUM(age) FROM users"));
        assertEquals(List.of(Map.of("SUM(total)", 50.0)), rows("SELECT SUM(total) FROM orders"));
        assertEquals(List.of(Map.of("COUNT(*)", 0L)), rows("SELECT COUNT(*) FROM users WHERE age > 100"));
    }

    @Test
    void orderByAndLimit() {
        List<Map<String, Object>> r = rows("SELECT name FROM users ORDER BY age DESC, name LIMIT 2");
        assertEquals(List.of(Map.of("name", "Jane"), Map.of("name", "Ann")), r);
        assertTrue(rows("SELECT * FROM users LIMIT 0").isEmpty());
        assertEquals(3, rows("SELECT * FROM users ORDER BY id").size());
    }

    @Test
    void tableNameMustBeAnIdentifier() {
        assertEquals(ErrorKind.MALFORMED_CREATE_TABLE, failure("CREATE TABLE ../../escaped (x INT)"));
        assertFalse(Files.exists(dir.getParent().resolve("escaped.jsonl")));
        assertFalse(Files.exists(layout.tablesDir().resolve("../../escaped.jsonl").normalize()));
    }

    @Test
    void validationErrors() {
        assertEquals(ErrorKind.TABLE_NOT_FOUND, failure("SELECT * FROM ghosts"));
        assertEquals(ErrorKind.COLUMN_NOT_FOUND, failure("SELECT email FROM users"));
        assertEquals(ErrorKind.COLUMN_NOT_FOUND, failure("SELECT * FROM users ORDER BY email"));
        assertEquals(ErrorKind.AGGREGATE_REQUIRES_GROUP_BY, failure("SELECT name, COUNT(*) FROM users"));
        assertEquals(ErrorKind.PLAN_ERROR, failure("SELECT SUM(*) FROM users"));
        assertEquals(ErrorKind.PLAN_ERROR, failure("SELECT * FROM users LIMIT -1"));
        assertEquals(ErrorKind.MALFORMED_PREDICATE, failure("SELECT * FROM users WHERE age"));
        assertEquals(ErrorKind.UNSUPPORTED_STATEMENT, failure("DELETE FROM users"));
        assertEquals(ErrorKind.TABLE_ALREADY_EXISTS, failure("CREATE TABLE users (x INT)"));
    }

    @Test
    void rejectedInsertLeavesNoGap() {
        assertEquals(ErrorKind.MALFORMED_INSERT, failure("INSERT INTO users (name, age) VALUES ('A', 1), ('B')"));
        assertEquals(ErrorKind.COLUMN_NOT_FOUND, failure("INSERT INTO users (email) VALUES ('x')"));
        assertEquals(ErrorKind.MALFORMED_INSERT, failure("INSERT INTO users (id, name) VALUES (9, 'x')"));
        assertEquals(ErrorKind.TABLE_NOT_FOUND, failure("INSERT INTO ghosts VALUES (1)"));

        qp.execute("INSERT INTO users VALUES ('Bob', 20)");
        assertEquals(4L, rows("SELECT * FROM users WHERE name = 'Bob'").get(0).get("id"));
    }

    @Test
    void groupByMergesIntegralFloatWithInteger() {
        qp.execute("CREATE TABLE t (k FLOAT)");
        qp.execute("INSERT INTO t (k) VALUES (50), (50.0), (50.5)");
        assertEquals(2, rows("SELECT * FROM t WHERE k = 50").size());

        List<Map<String, Object>> r = rows("SELECT k, COUNT(*) FROM t GROUP BY k");
        assertEquals(List.of(Map.of("k", 50L, "COUNT(*)", 2L), Map.of("k", 50.5, "COUNT(*)", 1L)), r);
    }

    // a table whose declared order is not insertion order
    private void rankedTable() throws Exception {
        pool.drain();
        Files.writeString(layout.catalogFile(),
            "{\"ranked\":{\"columns\":{\"name\":\"TEXT\",\"age\":\"INT\"},\"sort\":\"age DESC\"}}");
        Files.writeString(layout.tableFile("ranked"),
            "{\"id\":1,\"name\":\"a\",\"age\":40}\n"
                + "{\"id\":2,\"name\":\"b\",\"age\":60}\n"
                + "{\"id\":3,\"name\":\"c\",\"age\":50}\n");
    }

    @Test
    void insertIntoSortedTableViolatesAppendOnly() throws Exception {
        rankedTable();
        DbException e = assertThrows(DbException.class,
            () -> qp.execute("INSERT INTO ranked (name, age) VALUES ('d', 1)"));
        assertEquals(ErrorKind.APPEND_ONLY_VIOLATION, e.kind());
        assertEquals(3, rows("SELECT * FROM ranked").size());
    }

    @Test
    void orderMatchingDeclaredSortStreamsInFileOrder() throws Exception {
        rankedTable();
        List<Map<String, Object>> declared = rows("SELECT name FROM ranked ORDER BY age DESC");
        assertEquals(List.of("a", "b", "c"), declared.stream().map(r -> r.get("name")).toList());

        List<Map<String, Object>> sorted = rows("SELECT name FROM ranked ORDER BY age ASC");
        assertEquals(List.of("a", "c", "b"), sorted.stream().map(r -> r.get("name")).toList());
    }

    @Test
    void nullSqlIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> qp.execute(null));
    }
}
