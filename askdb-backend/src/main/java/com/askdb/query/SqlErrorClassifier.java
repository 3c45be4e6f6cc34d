package com.askdb.query;

import com.askdb.util.DsnRedactor;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.Locale;
import java.util.Map;

/**
 * Maps native JDBC failures onto {@link ExecutionErrorKind}.
 *
 * <p>Order of checks: socket-level causes, pool exhaustion, timeouts, SQLSTATE (PostgreSQL and
 * SQL-standard/H2 codes), then a message heuristic. Anything left is {@code DATABASE_ERROR}
 * with the scrubbed native message.
 */
public final class SqlErrorClassifier {

    private static final Map<String, ExecutionErrorKind> SQL_STATES = Map.ofEntries(
            Map.entry("28P01", ExecutionErrorKind.AUTHENTICATION_FAILED),
            Map.entry("28000", ExecutionErrorKind.AUTHENTICATION_FAILED),
            Map.entry("3D000", ExecutionErrorKind.DATABASE_NOT_FOUND),
            Map.entry("90013", ExecutionErrorKind.DATABASE_NOT_FOUND),
            Map.entry("90146", ExecutionErrorKind.DATABASE_NOT_FOUND),
            Map.entry("42P01", ExecutionErrorKind.TABLE_NOT_FOUND),
            Map.entry("42S02", ExecutionErrorKind.TABLE_NOT_FOUND),
            Map.entry("42102", ExecutionErrorKind.TABLE_NOT_FOUND),
            Map.entry("42103", ExecutionErrorKind.TABLE_NOT_FOUND),
            Map.entry("42104", ExecutionErrorKind.TABLE_NOT_FOUND),
            Map.entry("42601", ExecutionErrorKind.SYNTAX_ERROR),
            Map.entry("42000", ExecutionErrorKind.SYNTAX_ERROR),
            Map.entry("42001", ExecutionErrorKind.SYNTAX_ERROR),
            Map.entry("23505", ExecutionErrorKind.UNIQUE_CONSTRAINT_VIOLATION),
            Map.entry("23503", ExecutionErrorKind.FOREIGN_KEY_VIOLATION),
            Map.entry("23506", ExecutionErrorKind.FOREIGN_KEY_VIOLATION),
            Map.entry("57014", ExecutionErrorKind.TIMEOUT)
    );

    private static final String UNKNOWN_STATE = "UNKNOWN";

    private SqlErrorClassifier() {
    }

    /**
     * Classify a failure.
     *
     * @param error native failure
     * @param dsn DSN of the target, scrubbed from every message; may be null
     * @return classified exception, ready to throw
     */
    public static QueryExecutionException classify(Throwable error, String dsn) {
        SQLException sqlException = firstSqlException(error);
        String sqlState = firstSqlState(error);
        String detail = DsnRedactor.scrub(error != null ? error.getMessage() : null, dsn);

        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectException) {
                return build(ExecutionErrorKind.CONNECTION_REFUSED, sqlState, detail);
            }
            if (t instanceof UnknownHostException) {
                return build(ExecutionErrorKind.HOST_NOT_FOUND, sqlState, detail);
            }
            if (t instanceof SocketTimeoutException) {
                return build(ExecutionErrorKind.TIMEOUT, sqlState, detail);
            }
            if (t.getCause() == t) {
                break;
            }
        }

        // Hikari reports a plain wait timeout without a cause; with a cause the driver failed
        if (sqlException instanceof SQLTransientConnectionException && sqlException.getCause() == null) {
            return build(ExecutionErrorKind.POOL_EXHAUSTED, sqlState, detail);
        }
        if (sqlException instanceof SQLTimeoutException) {
            return build(ExecutionErrorKind.TIMEOUT, sqlState, detail);
        }

        if (sqlState != null) {
            ExecutionErrorKind kind = SQL_STATES.get(sqlState.toUpperCase(Locale.ROOT));
            if (kind != null) {
                return build(kind, sqlState, detail);
            }
            if (sqlState.startsWith("08")) {
                return build(ExecutionErrorKind.CONNECTION_REFUSED, sqlState, detail);
            }
        }

        String lower = detail != null ? detail.toLowerCase(Locale.ROOT) : "";
        if (lower.contains("timeout") || lower.contains("timed out")) {
            return build(ExecutionErrorKind.TIMEOUT, sqlState, detail);
        }

        String message = "Database error: " + (detail != null ? detail : "unknown error")
                + " (" + stateOrUnknown(sqlState) + ")";
        return new QueryExecutionException(ExecutionErrorKind.DATABASE_ERROR, message, sqlState, detail);
    }

    private static QueryExecutionException build(ExecutionErrorKind kind, String sqlState, String detail) {
        String message = kind.getDefaultMessage() + " (" + stateOrUnknown(sqlState) + ")";
        return new QueryExecutionException(kind, message, sqlState, detail);
    }

    private static String stateOrUnknown(String sqlState) {
        return sqlState != null && !sqlState.isBlank() ? sqlState : UNKNOWN_STATE;
    }

    private static SQLException firstSqlException(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException e) {
                return e;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }

    private static String firstSqlState(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException e && e.getSQLState() != null && !e.getSQLState().isBlank()) {
                return e.getSQLState();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return null;
    }
}
