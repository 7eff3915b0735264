package db.minipg.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.google.gson.Gson;

import db.minipg.MiniPgEngine;
import db.minipg.config.EngineConfig;
import db.minipg.query.QueryResult;
import db.minipg.storage.JsonDocumentStore;

/**
 * Command line front end.
 *
 * <pre>
 *   minipg [--data-dir=./data] [--json] ["SELECT * FROM users"]
 * </pre>
 * With a query argument the query runs once; otherwise queries are read line by line
 * until {@code \q}. Options are {@link EngineConfig} keys written as {@code --key=value}.
 */
public class Main {
    static final String QUIT = "\\q";
    private static final String PROMPT = "Enter a query [or exit (\\q)]: ";

    public static void main(String[] args) throws IOException {
        EngineConfig config = EngineConfig.fromArgs(args);
        boolean json = false;
        String query = null;
        for (String a : args) {
            if (a.equals("--json")) json = true;
            else if (!a.startsWith("--")) query = a;
        }
        try (MiniPgEngine engine = MiniPgEngine.open(config)) {
            if (query != null) {
                System.out.println("Running query: " + query);
                print(engine.runQuery(query), json, System.out);
            } else {
                repl(engine, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), json, System.out);
            }
        }
    }

    /** Read queries until {@code \q} or end of input. */
    static void repl(MiniPgEngine engine, BufferedReader in, boolean json, PrintStream out) throws IOException {
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break;
            line = line.trim();
            if (line.equals(QUIT)) break;
            if (line.isEmpty()) continue;
            print(engine.runQuery(line), json, out);
        }
    }

    static void print(QueryResult result, boolean json, PrintStream out) {
        if (result.rows() != null && !result.rows().isEmpty()) {
            if (json) {
                Gson gson = JsonDocumentStore.newGson();
                for (Map<String, Object> row : result.rows()) out.println(gson.toJson(row));
            } else {
                TablePrinter.print(result.rows(), out);
            }
        }
        out.println(result.message());
    }
}
