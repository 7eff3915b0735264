package db.minipg.seq;

import java.lang.reflect.Type;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.reflect.TypeToken;

import db.minipg.DbException;
import db.minipg.storage.JsonDocumentStore;
import db.minipg.worker.BackgroundWorkerPool;

/**
 * Named auto-increment counters with a write-back cache.
 *
 * The in-memory value is authoritative between flushes. Each sequence counts cache hits;
 * once a sequence reaches {@code flushAfter} hits (or a flush is requested) its current
 * value is written to {@code global/mpg_sequences.json} on the background pool.
 * {@link #flushAll()} writes the whole cache synchronously and is called on shutdown.
 * A crash may lose up to {@code flushAfter - 1} increments per sequence.
 */
public class SequenceManager {
    private static final Logger log = LoggerFactory.getLogger(SequenceManager.class);
    private static final Type SEQUENCES_TYPE = new TypeToken<LinkedHashMap<String, Long>>(){}.getType();

    private final JsonDocumentStore documents;
    private final Path sequencesFile;
    private final BackgroundWorkerPool pool;
    private final int flushAfter;

    private final Map<String, Long> cache = new HashMap<>();
    private final Map<String, Integer> hits = new HashMap<>();

    public SequenceManager(JsonDocumentStore documents, Path sequencesFile, BackgroundWorkerPool pool, int flushAfter) {
        if (flushAfter < 1) throw new IllegalArgumentException("flushAfter must be >= 1");
        this.documents = documents;
        this.sequencesFile = sequencesFile;
        this.pool = pool;
        this.flushAfter = flushAfter;
        documents.ensureDocument(sequencesFile);
    }

    /** Register a sequence starting at 0 (first value handed out is 1). Existing sequences are kept. */
    public void register(String name) {
        documents.<Long>update(sequencesFile, SEQUENCES_TYPE, doc -> doc.putIfAbsent(name, 0L));
        log.debug("Registered sequence {}", name);
    }

    public long nextValue(String name) {
        return nextValue(name, false);
    }

    /**
     * Increment and return the sequence.
     *
     * @param flush schedule a disk write now regardless of the hit count
     * @throws DbException SEQUENCE_NOT_FOUND if the sequence was never registered
     */
    public synchronized long nextValue(String name, boolean flush) {
        Long current = cache.get(name);
        if (current == null) {
            Long persisted = loadPersisted().get(name);
            if (persisted == null) throw DbException.sequenceNotFound(name);
            current = persisted;
        }
        long next = current + 1;
        cache.put(name, next);
        int h = hits.merge(name, 1, Integer::sum);
        if (h >= flushAfter || flush) {
            scheduleFlush(name, next);
            hits.put(name, 0);
        }
        return next;
    }

    public synchronized Long cachedValue(String name) {
        return cache.get(name);
    }

    /** Value currently on disk, or null if the sequence is not registered. */
    public Long persistedValue(String name) {
        return loadPersisted().get(name);
    }

    /** Write every cached value to disk on the calling thread. */
    public synchronized void flushAll() {
        if (cache.isEmpty()) return;
        Map<String, Long> snapshot = new LinkedHashMap<>(cache);
        documents.<Long>update(sequencesFile, SEQUENCES_TYPE,
            doc -> snapshot.forEach((name, value) -> doc.merge(name, value, Math::max)));
        hits.replaceAll((name, h) -> 0);
        log.debug("Flushed {} cached sequence(s)", snapshot.size());
    }

    private void scheduleFlush(String name, long value) {
        try {
            pool.submit("flush " + name, () -> persist(name, value));
        } catch (IllegalStateException e) {
            log.debug("Background pool unavailable, flushing {} inline", name);
            persist(name, value);
        }
    }

    // Writes never move a persisted value backwards, so out-of-order flushes are harmless.
    private void persist(String name, long value) {
        documents.<Long>update(sequencesFile, SEQUENCES_TYPE, doc -> doc.merge(name, value, Math::max));
        log.debug("Persisted sequence {} = {}", name, value);
    }

    private Map<String, Long> loadPersisted() {
        Map<String, Long> doc = documents.read(sequencesFile, SEQUENCES_TYPE);
        return doc == null ? Map.of() : doc;
    }
}
