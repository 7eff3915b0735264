package db.minipg.storage;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import db.minipg.DbException;

/**
 * Line-delimited JSON storage: {@code json_db/<table>.jsonl}, one flat object per line,
 * rows appended in insertion order.
 */
public class JsonLinesBackend implements StorageBackend {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesBackend.class);
    private static final Type ROW_TYPE = new TypeToken<LinkedHashMap<String, Object>>(){}.getType();

    private final DataLayout layout;
    private final Gson gson;

    public JsonLinesBackend(DataLayout layout, Gson gson) {
        this.layout = layout;
        this.gson = gson;
    }

    @Override
    public void createTable(String table) {
        Path file = layout.tableFile(table);
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, new byte[0]);
            log.debug("Created table file: {}", file);
        } catch (IOException e) {
            throw DbException.storage("Failed creating table file " + file, e);
        }
    }

    @Override
    public void append(String table, List<Map<String, Object>> rows) {
        Path file = layout.tableFile(table);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (Map<String, Object> row : rows) {
                writer.write(gson.toJson(row));
                writer.write('\n');
            }
        } catch (IOException e) {
            throw DbException.storage("Failed appending to table file " + file, e);
        }
    }

    @Override
    public RowCursor scan(String table) {
        Path file = layout.tableFile(table);
        BufferedReader reader;
        try {
            reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw DbException.storage("Storage file missing for table '" + table + "': " + file, e);
        } catch (IOException e) {
            throw DbException.storage("Failed opening table file " + file, e);
        }
        return new LineCursor(file, reader);
    }

    @Override
    public List<Map<String, Object>> readAll(String table) {
        List<Map<String, Object>> out = new ArrayList<>();
        try (RowCursor cursor = scan(table)) {
            Map<String, Object> row;
            while ((row = cursor.next()) != null) out.add(row);
        }
        return out;
    }

    private final class LineCursor implements RowCursor {
        private final Path file;
        private final BufferedReader reader;
        private int lineNo;

        LineCursor(Path file, BufferedReader reader) {
            this.file = file;
            this.reader = reader;
        }

        @Override
        public Map<String, Object> next() {
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    lineNo++;
                    if (line.isBlank()) continue;
                    return gson.fromJson(line, ROW_TYPE);
                }
                return null;
            } catch (IOException | JsonParseException e) {
                throw DbException.storage("Failed reading " + file + " at line " + lineNo, e);
            }
        }

        @Override
        public void close() {
            try {
                reader.close();
            } catch (IOException e) {
                throw DbException.storage("Failed closing " + file, e);
            }
        }
    }
}
