package com.askdb.query;

import com.askdb.pool.ConnectionPoolManager;
import com.askdb.pool.TenantPool;
import com.askdb.util.JdbcJsonSafe;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one statement on a pooled tenant connection.
 *
 * <p>The connection goes back to the pool on every exit path. The executor never retries and
 * never rewrites the statement; the row limit is enforced while reading the result.
 */
@Slf4j
public class QueryExecutor {

    private final ConnectionPoolManager poolManager;
    private final QuerySettings settings;

    /**
     * Create a query executor.
     *
     * @param poolManager source of tenant connections
     * @param settings row limit and statement timeout
     */
    public QueryExecutor(ConnectionPoolManager poolManager, QuerySettings settings) {
        this.poolManager = poolManager;
        this.settings = settings;
    }

    /**
     * Execute a statement.
     *
     * @param tenantId tenant identifier
     * @param dsn tenant DSN
     * @param statement SQL text, executed as given
     * @return rows, row count and elapsed time
     * @throws QueryExecutionException classified failure
     */
    public ExecutionOutcome execute(String tenantId, String dsn, String statement) {
        long startTime = System.currentTimeMillis();
        TenantPool pool = poolManager.acquire(tenantId, dsn);
        Connection conn = null;
        try {
            conn = pool.borrow();
            try (Statement stmt = conn.createStatement()) {
                long timeoutMs = settings.statementTimeout().toMillis();
                if (timeoutMs > 0) {
                    stmt.setQueryTimeout((int) Math.max(1, (timeoutMs + 999) / 1000));
                }
                stmt.setMaxRows(driverRowCap(settings.maxRows()));

                boolean isResultSet = stmt.execute(statement);
                long duration = System.currentTimeMillis() - startTime;

                if (!isResultSet) {
                    int updateCount = Math.max(0, stmt.getUpdateCount());
                    return new ExecutionOutcome(List.of(), updateCount, duration);
                }
                try (ResultSet rs = stmt.getResultSet()) {
                    List<Map<String, Object>> rows = readRows(rs);
                    log.debug("Query for tenant {} returned {} row(s) in {} ms", tenantId, rows.size(), duration);
                    return new ExecutionOutcome(rows, rows.size(), duration);
                }
            }
        } catch (SQLException e) {
            QueryExecutionException classified = SqlErrorClassifier.classify(e, dsn);
            log.warn("Query failed for tenant {} (kind={}, sql_state={})",
                    tenantId, classified.getKind(), classified.getSqlState());
            throw classified;
        } finally {
            poolManager.releaseConnection(pool, conn);
        }
    }

    /**
     * Row cap handed to the driver: one extra row is enough to detect an oversized result.
     * Zero (no cap) when the limit leaves no room for that extra row.
     */
    static int driverRowCap(int maxRows) {
        return maxRows < Integer.MAX_VALUE ? maxRows + 1 : 0;
    }

    private List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            if (rows.size() >= settings.maxRows()) {
                throw new QueryExecutionException(
                        ExecutionErrorKind.RESULT_TOO_LARGE,
                        "Query result exceeds maximum allowed rows (" + settings.maxRows()
                                + "). Add filtering (a WHERE clause or LIMIT) to narrow the result."
                );
            }
            rows.add(JdbcJsonSafe.readRow(rs, meta));
        }
        return rows;
    }
}
