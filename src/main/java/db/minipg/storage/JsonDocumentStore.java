package db.minipg.storage;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;

import db.minipg.DbException;

/**
 * Whole-document JSON files: every read loads the file, every mutation is a
 * read-modify-write of the entire document. Mutations of one document are serialized
 * by a per-path lock; there is no cross-process locking.
 */
public class JsonDocumentStore {
    private final Gson gson;
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public JsonDocumentStore(Gson gson) {
        this.gson = gson;
    }

    /** Gson configured for row and document values: integral numbers read back as Long. */
    public static Gson newGson() {
        return new GsonBuilder()
                .serializeNulls()
                .disableHtmlEscaping()
                .serializeSpecialFloatingPointValues()
                .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
                .create();
    }

    public Gson gson() { return gson; }

    /** Write {@code {}} if the document does not exist yet. */
    public void ensureDocument(Path file) {
        withLock(file, () -> {
            if (!Files.exists(file)) writeUnlocked(file, new LinkedHashMap<>());
        });
    }

    public <T> T read(Path file, Type type) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return gson.fromJson(reader, type);
        } catch (IOException | JsonParseException e) {
            throw DbException.storage("Failed reading document " + file, e);
        }
    }

    public String readRaw(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw DbException.storage("Failed reading document " + file, e);
        }
    }

    public void write(Path file, Object document) {
        withLock(file, () -> writeUnlocked(file, document));
    }

    /**
     * Load the map document, let {@code mutator} change it and write the whole document back.
     */
    public <V> void update(Path file, Type mapType, Consumer<Map<String, V>> mutator) {
        withLock(file, () -> {
            Map<String, V> doc = Files.exists(file) ? read(file, mapType) : null;
            if (doc == null) doc = new LinkedHashMap<>();
            mutator.accept(doc);
            writeUnlocked(file, doc);
        });
    }

    private void writeUnlocked(Path file, Object document) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(document, writer);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw DbException.storage("Failed writing document " + file, e);
        }
    }

    private void withLock(Path file, Runnable action) {
        ReentrantLock lock = locks.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new ReentrantLock());
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }
}
