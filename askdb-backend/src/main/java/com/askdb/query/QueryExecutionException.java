package com.askdb.query;

/**
 * Classified failure of a pool or executor operation. The message never contains a DSN.
 */
public class QueryExecutionException extends RuntimeException {

    private final ExecutionErrorKind kind;
    private final String sqlState;
    private final String detail;

    public QueryExecutionException(ExecutionErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    /**
     * Create a classified failure.
     *
     * @param kind failure kind
     * @param message caller-facing message, already scrubbed
     * @param sqlState SQLSTATE of the native error, may be null
     * @param detail scrubbed native error message, may be null
     */
    public QueryExecutionException(ExecutionErrorKind kind, String message, String sqlState, String detail) {
        super(message);
        this.kind = kind;
        this.sqlState = sqlState;
        this.detail = detail;
    }

    public ExecutionErrorKind getKind() {
        return kind;
    }

    public String getSqlState() {
        return sqlState;
    }

    public String getDetail() {
        return detail;
    }
}
