package db.minipg;

import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;

import db.minipg.catalog.CatalogManager;
import db.minipg.config.EngineConfig;
import db.minipg.query.Plan;
import db.minipg.query.QueryExecutor;
import db.minipg.query.QueryProcessor;
import db.minipg.query.QueryResult;
import db.minipg.seq.SequenceManager;
import db.minipg.stats.StatsManager;
import db.minipg.stats.StatsRefreshReport;
import db.minipg.stats.TableStatistics;
import db.minipg.storage.DataLayout;
import db.minipg.storage.JsonDocumentStore;
import db.minipg.storage.JsonLinesBackend;
import db.minipg.storage.StorageBackend;
import db.minipg.worker.BackgroundWorkerPool;

/**
 * One open database: owns the catalog, storage, sequence cache, statistics and the
 * background pool for a data directory.
 *
 * <pre>
 * try (MiniPgEngine engine = MiniPgEngine.open(EngineConfig.load())) {
 *     QueryResult r = engine.runQuery("SELECT * FROM users");
 * }
 * </pre>
 *
 * Closing stops new queries, waits for background work and writes the sequence cache,
 * so no generated id is lost on a clean shutdown.
 */
public class MiniPgEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MiniPgEngine.class);

    private final EngineConfig config;
    private final CatalogManager catalog;
    private final StorageBackend storage;
    private final SequenceManager sequences;
    private final StatsManager stats;
    private final BackgroundWorkerPool pool;
    private final QueryProcessor processor;
    private volatile boolean closed;

    private MiniPgEngine(EngineConfig config, Function<QueryExecutor, QueryProcessor> processorFactory) {
        this.config = config;
        DataLayout layout = new DataLayout(config.dataDir);
        layout.initialize();
        Gson gson = JsonDocumentStore.newGson();
        JsonDocumentStore documents = new JsonDocumentStore(gson);
        this.pool = new BackgroundWorkerPool(config.maxBgWorkers, config.bgQueueCapacity);
        this.catalog = new CatalogManager(documents, layout.catalogFile());
        this.storage = new JsonLinesBackend(layout, gson);
        this.sequences = new SequenceManager(documents, layout.sequencesFile(), pool, config.seqCacheFlushAfter);
        this.stats = new StatsManager(catalog, storage, documents, layout, config.maxStatsWorkers);
        this.processor = processorFactory.apply(
            new QueryExecutor(catalog, storage, sequences, stats, pool, config.statsOnInsert));
    }

    /** Open (creating if needed) the database under {@code config.dataDir}. */
    public static MiniPgEngine open(EngineConfig config) {
        return open(config, QueryProcessor::new);
    }

    static MiniPgEngine open(EngineConfig config, Function<QueryExecutor, QueryProcessor> processorFactory) {
        MiniPgEngine engine = new MiniPgEngine(config, processorFactory);
        log.info("Starting MiniPG engine on {}", config.dataDir.toAbsolutePath());
        return engine;
    }

    /**
     * Run one statement. Never throws for a failing statement: the result then carries an
     * {@code "Error: ..."} message and no rows.
     */
    public QueryResult runQuery(String sql) {
        if (closed) return QueryResult.error("Engine is closed");
        try {
            return processor.execute(sql);
        } catch (DbException e) {
            log.debug("Query failed ({}): {}", e.kind(), e.getMessage());
            return QueryResult.error(e.getMessage());
        } catch (IllegalArgumentException e) {
            return QueryResult.error(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected failure running query: {}", sql, e);
            return QueryResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /** Compile a statement without running it. */
    public Plan explain(String sql) {
        return processor.compile(sql);
    }

    public TableStatistics getTableStats(String table) {
        return stats.getTableStats(table);
    }

    public String getTableStatsDocument(String table) {
        return stats.getTableStatsDocument(table);
    }

    public TableStatistics updateTableStats(String table) {
        return stats.updateTableStats(table);
    }

    public StatsRefreshReport updateAllTableStats() {
        return stats.updateAllTableStats();
    }

    public CatalogManager catalog() { return catalog; }
    public SequenceManager sequences() { return sequences; }
    public EngineConfig config() { return config; }
    public boolean isClosed() { return closed; }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        log.info("Shutting down MiniPG engine");
        pool.close();
        sequences.flushAll();
    }
}
