package db.minipg.query;

import db.minipg.sql.SqlTokenizer;
import db.minipg.sql.TokenizedStatement;

/**
 * Processor combining tokenizing, plan compilation and execution of one statement.
 */
public class QueryProcessor {
    private final SqlTokenizer tokenizer = new SqlTokenizer();
    private final QueryPlanner planner = new QueryPlanner();
    private final QueryExecutor executor;

    public QueryProcessor(QueryExecutor executor) {
        this.executor = executor;
    }

    /** Tokenize and compile without executing. */
    public Plan compile(String sql) {
        if (sql == null) throw new IllegalArgumentException("sql must not be null");
        TokenizedStatement statement = tokenizer.tokenize(sql);
        return planner.plan(statement);
    }

    /**
     * Unified execution entry point.
     * SELECT -> status with the row count and the rows.
     * INSERT -> status with the inserted count, no rows.
     * CREATE TABLE -> status, no rows.
     *
     * @throws db.minipg.DbException for any invalid or failing statement
     */
    public QueryResult execute(String sql) {
        return executor.execute(compile(sql));
    }
}
