package db.minipg.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Engine settings. Defaults come from the classpath {@code minipg.properties};
 * explicit properties and {@code --key=value} arguments override them.
 */
public class EngineConfig {
    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "minipg.properties";

    public static final String DATA_DIR = "data_dir";
    public static final String SEQ_CACHE_FLUSH_AFTER = "seq_cache_flush_after";
    public static final String MAX_BG_WORKERS = "max_bg_workers";
    public static final String MAX_STATS_WORKERS = "max_stats_workers";
    public static final String BG_QUEUE_CAPACITY = "bg_queue_capacity";
    public static final String STATS_ON_INSERT = "stats_on_insert";

    public final Path dataDir;
    public final int seqCacheFlushAfter;
    public final int maxBgWorkers;
    public final int maxStatsWorkers;
    public final int bgQueueCapacity;
    public final boolean statsOnInsert;

    public EngineConfig(Path dataDir,
                        int seqCacheFlushAfter,
                        int maxBgWorkers,
                        int maxStatsWorkers,
                        int bgQueueCapacity,
                        boolean statsOnInsert) {
        if (dataDir == null) throw new IllegalArgumentException("dataDir must not be null");
        if (seqCacheFlushAfter < 1) throw new IllegalArgumentException("seq_cache_flush_after must be >= 1");
        if (maxBgWorkers < 1) throw new IllegalArgumentException("max_bg_workers must be >= 1");
        if (maxStatsWorkers < 1) throw new IllegalArgumentException("max_stats_workers must be >= 1");
        if (bgQueueCapacity < 1) throw new IllegalArgumentException("bg_queue_capacity must be >= 1");
        this.dataDir = dataDir;
        this.seqCacheFlushAfter = seqCacheFlushAfter;
        this.maxBgWorkers = maxBgWorkers;
        this.maxStatsWorkers = maxStatsWorkers;
        this.bgQueueCapacity = bgQueueCapacity;
        this.statsOnInsert = statsOnInsert;
    }

    public static EngineConfig defaultConfig(Path dataDir) {
        return new EngineConfig(
                dataDir,
                10,    // sequence cache hits before an async flush
                4,     // background workers
                4,     // stats refresh workers
                256,   // background queue capacity
                false  // refresh stats after INSERT
        );
    }

    /** Defaults overlaid with the bundled {@value #RESOURCE}. */
    public static EngineConfig load() {
        return fromProperties(bundledProperties());
    }

    public static EngineConfig fromProperties(Properties props) {
        EngineConfig base = defaultConfig(Path.of("./data"));
        Path dataDir = base.dataDir;
        String dir = props.getProperty(DATA_DIR);
        if (dir != null && !dir.isBlank()) dataDir = Path.of(dir.trim());
        return new EngineConfig(
                dataDir,
                intProp(props, SEQ_CACHE_FLUSH_AFTER, base.seqCacheFlushAfter),
                intProp(props, MAX_BG_WORKERS, base.maxBgWorkers),
                intProp(props, MAX_STATS_WORKERS, base.maxStatsWorkers),
                intProp(props, BG_QUEUE_CAPACITY, base.bgQueueCapacity),
                Boolean.parseBoolean(props.getProperty(STATS_ON_INSERT, Boolean.toString(base.statsOnInsert)).trim())
        );
    }

    /**
     * Bundled properties overridden by {@code --key=value} arguments. Arguments that are not
     * options are ignored here.
     */
    public static EngineConfig fromArgs(String[] args) {
        Properties props = bundledProperties();
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (!s.startsWith("--")) continue;
            int eq = s.indexOf('=');
            if (eq < 0) continue; // flags such as --json are handled by the CLI
            String key = s.substring(2, eq).replace('-', '_');
            props.setProperty(key, s.substring(eq + 1));
        }
        return fromProperties(props);
    }

    public EngineConfig withDataDir(Path dir) {
        return new EngineConfig(dir, seqCacheFlushAfter, maxBgWorkers, maxStatsWorkers, bgQueueCapacity, statsOnInsert);
    }

    private static Properties bundledProperties() {
        Properties props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            log.warn("Failed reading {}, using built-in defaults", RESOURCE, e);
        }
        return props;
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value '{}' for {}, keeping {}", raw, key, fallback);
            return fallback;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{dataDir=" + dataDir
                + ", seqCacheFlushAfter=" + seqCacheFlushAfter
                + ", maxBgWorkers=" + maxBgWorkers
                + ", maxStatsWorkers=" + maxStatsWorkers
                + ", bgQueueCapacity=" + bgQueueCapacity
                + ", statsOnInsert=" + statsOnInsert + "}";
    }
}
