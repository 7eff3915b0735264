package db.minipg.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.reflect.TypeToken;

public class JsonDocumentStoreTest {
    private static final Type LONG_MAP = new TypeToken<LinkedHashMap<String, Long>>(){}.getType();

    @TempDir
    Path dir;

    @Test
    void ensureDocumentWritesEmptyObjectOnce() {
        JsonDocumentStore store = new JsonDocumentStore(JsonDocumentStore.newGson());
        Path file = dir.resolve("doc.json");
        store.ensureDocument(file);
        assertEquals("{}", store.readRaw(file));

        store.<Long>update(file, LONG_MAP, doc -> doc.put("a", 1L));
        store.ensureDocument(file);
        Map<String, Long> doc = store.read(file, LONG_MAP);
        assertEquals(Map.of("a", 1L), doc);
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        JsonDocumentStore store = new JsonDocumentStore(JsonDocumentStore.newGson());
        Path file = dir.resolve("counters.json");
        store.ensureDocument(file);

        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread thread = new Thread(() -> {
                for (int i = 0; i < 25; i++) {
                    store.<Long>update(file, LONG_MAP, doc -> doc.merge("n", 1L, Long::sum));
                }
            });
            threads.add(thread);
            thread.start();
        }
        for (Thread t : threads) t.join();

        Map<String, Long> doc = store.read(file, LONG_MAP);
        assertEquals(100L, doc.get("n"));
        assertFalse(Files.exists(dir.resolve("counters.json.tmp")));
    }
}
