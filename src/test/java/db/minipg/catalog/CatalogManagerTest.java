package db.minipg.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.minipg.DbException;
import db.minipg.ErrorKind;
import db.minipg.storage.DataLayout;
import db.minipg.storage.JsonDocumentStore;

public class CatalogManagerTest {
    @TempDir
    Path dir;

    private DataLayout layout;
    private JsonDocumentStore documents;

    @BeforeEach
    void setUp() {
        layout = new DataLayout(dir);
        layout.initialize();
        documents = new JsonDocumentStore(JsonDocumentStore.newGson());
    }

    private static Map<String, String> columns(String... nameType) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < nameType.length; i += 2) m.put(nameType[i], nameType[i + 1]);
        return m;
    }

    @Test
    void createdTableIsVisibleToAnotherInstance() {
        CatalogManager catalog = new CatalogManager(documents, layout.catalogFile());
        catalog.createTable("users", columns("name", "TEXT", "age", "INT"));

        CatalogManager other = new CatalogManager(documents, layout.catalogFile());
        TableSchema schema = other.getTableSchema("users");
        assertNotNull(schema);
        assertEquals(List.of("name", "age"), List.copyOf(schema.columns().keySet()));
        assertEquals("INT", schema.columns().get("age"));
        assertEquals(TableSchema.APPEND_ONLY_SORT, schema.sort());
        assertTrue(schema.isAppendOnly());
        assertEquals("users_id_seq", schema.sequenceName());
        assertTrue(other.exists("users"));
        assertEquals(List.of("users"), other.tableNames());
    }

    @Test
    void duplicateCreateKeepsExistingSchema() {
        CatalogManager catalog = new CatalogManager(documents, layout.catalogFile());
        catalog.createTable("users", columns("name", "TEXT"));

        DbException e = assertThrows(DbException.class,
            () -> catalog.createTable("users", columns("email", "TEXT")));
        assertEquals(ErrorKind.TABLE_ALREADY_EXISTS, e.kind());
        assertEquals(columns("name", "TEXT"), catalog.getTableSchema("users").columns());
    }

    @Test
    void unknownTable() {
        CatalogManager catalog = new CatalogManager(documents, layout.catalogFile());
        assertNull(catalog.getTableSchema("ghost"));
        assertFalse(catalog.exists("ghost"));
        assertTrue(catalog.tableNames().isEmpty());
    }

    @Test
    void idColumnIsImplicit() {
        TableSchema schema = new TableSchema("t", columns("name", "TEXT"), TableSchema.APPEND_ONLY_SORT);
        assertTrue(schema.hasColumn("id"));
        assertTrue(schema.hasColumn("name"));
        assertFalse(schema.hasColumn("age"));
        assertFalse(new TableSchema("t", Map.of(), "name DESC").isAppendOnly());
    }
}
