package db.minipg.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.minipg.DbException;
import db.minipg.ErrorKind;

public class JsonLinesBackendTest {
    @TempDir
    Path dir;

    private DataLayout layout;
    private JsonLinesBackend backend;

    @BeforeEach
    void setUp() {
        layout = new DataLayout(dir);
        layout.initialize();
        backend = new JsonLinesBackend(layout, JsonDocumentStore.newGson());
    }

    private static Map<String, Object> row(long id, String name, Object age) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("name", name);
        m.put("age", age);
        return m;
    }

    @Test
    void appendThenScanPreservesOrderAndKinds() throws Exception {
        backend.createTable("users");
        backend.append("users", List.of(row(1, "John", 50L), row(2, "Jane", 51.5)));
        backend.append("users", List.of(row(3, "Ann", null)));

        List<Map<String, Object>> rows = backend.readAll("users");
        assertEquals(3, rows.size());
        assertEquals(1L, rows.get(0).get("id"));
        assertEquals(50L, rows.get(0).get("age"));
        assertEquals(51.5, rows.get(1).get("age"));
        assertTrue(rows.get(2).containsKey("age"));
        assertNull(rows.get(2).get("age"));
        assertEquals(List.of("id", "name", "age"), List.copyOf(rows.get(0).keySet()));

        List<String> lines = Files.readAllLines(layout.tableFile("users"));
        assertEquals("{\"id\":1,\"name\":\"John\",\"age\":50}", lines.get(0));
    }

    @Test
    void createTableTruncates() {
        backend.createTable("t");
        backend.append("t", List.of(row(1, "a", 1L)));
        backend.createTable("t");
        assertTrue(backend.readAll("t").isEmpty());
    }

    @Test
    void blankLinesAreSkipped() throws Exception {
        Files.writeString(layout.tableFile("t"), "{\"id\":1}\n\n{\"id\":2}\n");
        assertEquals(2, backend.readAll("t").size());
    }

    @Test
    void missingFileIsStorageFailure() {
        DbException e = assertThrows(DbException.class, () -> backend.scan("ghost"));
        assertEquals(ErrorKind.STORAGE_FAILURE, e.kind());
    }

    @Test
    void corruptLineIsStorageFailure() throws Exception {
        Files.writeString(layout.tableFile("t"), "{\"id\":1}\nnot json\n");
        DbException e = assertThrows(DbException.class, () -> backend.readAll("t"));
        assertEquals(ErrorKind.STORAGE_FAILURE, e.kind());
        assertTrue(e.getMessage().contains("line 2"));
    }
}
