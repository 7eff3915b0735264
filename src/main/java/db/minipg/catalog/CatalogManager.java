package db.minipg.catalog;

import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.reflect.TypeToken;

import db.minipg.DbException;
import db.minipg.storage.JsonDocumentStore;

/**
 * Durable table name to schema mapping, persisted as one JSON document
 * ({@code global/mpg_tables.json}). Nothing is cached: every lookup reloads the document
 * so that changes made by another engine instance are visible.
 */
public class CatalogManager {
    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

    private static final Type CATALOG_TYPE = new TypeToken<LinkedHashMap<String, Entry>>(){}.getType();

    /** Persisted form of one table; the table name is the document key. */
    record Entry(Map<String, String> columns, String sort) {}

    private final JsonDocumentStore documents;
    private final Path catalogFile;

    public CatalogManager(JsonDocumentStore documents, Path catalogFile) {
        this.documents = documents;
        this.catalogFile = catalogFile;
        documents.ensureDocument(catalogFile);
    }

    public TableSchema getTableSchema(String name) {
        Entry e = load().get(name);
        return e == null ? null : new TableSchema(name, e.columns(), e.sort());
    }

    public boolean exists(String name) {
        return load().containsKey(name);
    }

    public List<String> tableNames() {
        return new ArrayList<>(load().keySet());
    }

    /**
     * Register a new append-only table.
     *
     * @throws DbException TABLE_ALREADY_EXISTS if the name is taken; the existing schema is left untouched
     */
    public TableSchema createTable(String name, Map<String, String> columns) {
        TableSchema schema = new TableSchema(name, columns, TableSchema.APPEND_ONLY_SORT);
        documents.<Entry>update(catalogFile, CATALOG_TYPE, catalog -> {
            if (catalog.containsKey(name)) throw DbException.tableExists(name);
            catalog.put(name, new Entry(new LinkedHashMap<>(schema.columns()), schema.sort()));
        });
        log.debug("Registered table {} with columns {}", name, schema.columns());
        return schema;
    }

    private Map<String, Entry> load() {
        Map<String, Entry> catalog = documents.read(catalogFile, CATALOG_TYPE);
        return catalog == null ? new LinkedHashMap<>() : catalog;
    }
}
