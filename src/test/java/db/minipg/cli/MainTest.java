package db.minipg.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import db.minipg.MiniPgEngine;
import db.minipg.config.EngineConfig;

public class MainTest {
    @TempDir
    Path dir;

    private String session(String input, boolean json) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (MiniPgEngine engine = MiniPgEngine.open(EngineConfig.defaultConfig(dir));
             PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            Main.repl(engine, new BufferedReader(new StringReader(input)), json, out);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void replRunsUntilQuit() throws Exception {
        String out = session(String.join("\n",
            "CREATE TABLE users (name TEXT)",
            "",
            "INSERT INTO users VALUES ('John')",
            "SELECT * FROM users",
            "\\q",
            "SELECT * FROM never"), false);

        assertTrue(out.contains("Table 'users' created successfully"));
        assertTrue(out.contains("Inserted 1 records into table 'users'"));
        assertTrue(out.contains("| id | name |"));
        assertTrue(out.contains("Query OK, 1 rows returned"));
        assertFalse(out.contains("never"));
    }

    @Test
    void jsonOutputPrintsOneObjectPerRow() throws Exception {
        String out = session(String.join("\n",
            "CREATE TABLE t (x INT)",
            "INSERT INTO t VALUES (1), (2)",
            "SELECT x FROM t"), true);

        assertTrue(out.contains("{\"x\":1}"));
        assertTrue(out.contains("{\"x\":2}"));
        assertTrue(out.contains("Query OK, 2 rows returned"));
    }

    @Test
    void errorsArePrintedAsMessages() throws Exception {
        String out = session("SELECT * FROM ghosts\n", false);
        assertTrue(out.contains("Error: Table 'ghosts' not found in catalog"));
    }
}
