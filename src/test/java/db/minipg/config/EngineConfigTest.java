package db.minipg.config;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;

public class EngineConfigTest {

    @Test
    void defaults() {
        EngineConfig c = EngineConfig.defaultConfig(Path.of("d"));
        assertEquals(Path.of("d"), c.dataDir);
        assertEquals(10, c.seqCacheFlushAfter);
        assertEquals(4, c.maxBgWorkers);
        assertEquals(4, c.maxStatsWorkers);
        assertFalse(c.statsOnInsert);
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.DATA_DIR, " /tmp/minipg ");
        p.setProperty(EngineConfig.SEQ_CACHE_FLUSH_AFTER, "3");
        p.setProperty(EngineConfig.STATS_ON_INSERT, "true");
        EngineConfig c = EngineConfig.fromProperties(p);
        assertEquals(Path.of("/tmp/minipg"), c.dataDir);
        assertEquals(3, c.seqCacheFlushAfter);
        assertTrue(c.statsOnInsert);
        assertEquals(4, c.maxBgWorkers);
    }

    @Test
    void invalidIntegerKeepsDefault() {
        Properties p = new Properties();
        p.setProperty(EngineConfig.MAX_BG_WORKERS, "many");
        assertEquals(4, EngineConfig.fromProperties(p).maxBgWorkers);
    }

    @Test
    void argumentsUseDashedKeys() {
        EngineConfig c = EngineConfig.fromArgs(new String[] {
            "--data-dir=/srv/db", "--seq-cache-flush-after=2", "--json", "SELECT * FROM t"});
        assertEquals(Path.of("/srv/db"), c.dataDir);
        assertEquals(2, c.seqCacheFlushAfter);
    }

    @Test
    void rejectsNonPositiveSettings() {
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(Path.of("d"), 0, 1, 1, 1, false));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(null, 1, 1, 1, 1, false));
    }

    @Test
    void withDataDirKeepsOtherSettings() {
        EngineConfig c = new EngineConfig(Path.of("a"), 5, 2, 3, 8, true).withDataDir(Path.of("b"));
        assertEquals(Path.of("b"), c.dataDir);
        assertEquals(5, c.seqCacheFlushAfter);
        assertEquals(3, c.maxStatsWorkers);
        assertTrue(c.statsOnInsert);
    }
}
