package db.minipg.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import db.minipg.DbException;
import db.minipg.ErrorKind;

/**
 * On-disk layout under the data directory:
 * <pre>
 *   global/mpg_tables.json      catalog document
 *   global/mpg_sequences.json   sequence document
 *   json_db/&lt;table&gt;.jsonl      table rows, one JSON object per line
 *   mpg_stat/&lt;table&gt;.json      per-table statistics
 * </pre>
 */
public final class DataLayout {
    private final Path root;

    public DataLayout(Path root) {
        this.root = root;
    }

    public Path root() { return root; }
    public Path globalDir() { return root.resolve("global"); }
    public Path tablesDir() { return root.resolve("json_db"); }
    public Path statsDir() { return root.resolve("mpg_stat"); }

    public Path catalogFile() { return globalDir().resolve("mpg_tables.json"); }
    public Path sequencesFile() { return globalDir().resolve("mpg_sequences.json"); }
    public Path tableFile(String table) { return inside(tablesDir(), table + ".jsonl"); }
    public Path statsFile(String table) { return inside(statsDir(), table + ".json"); }

    // table names end up in file names; the resolved file must stay directly inside dir
    private static Path inside(Path dir, String fileName) {
        Path base = dir.toAbsolutePath().normalize();
        Path file = base.resolve(fileName).normalize();
        if (!base.equals(file.getParent())) {
            throw new DbException(ErrorKind.STORAGE_FAILURE, "Table file '" + fileName + "' resolves outside " + dir);
        }
        return file;
    }

    /** Create the directory tree. Idempotent. */
    public void initialize() {
        try {
            Files.createDirectories(globalDir());
            Files.createDirectories(tablesDir());
            Files.createDirectories(statsDir());
        } catch (IOException e) {
            throw DbException.storage("Failed creating data directories under " + root, e);
        }
    }
}
