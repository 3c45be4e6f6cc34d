package com.askdb.query;

/**
 * Closed set of failures reported by the pool manager and the query executor.
 */
public enum ExecutionErrorKind {
    CONNECTION_REFUSED("Connection refused: the database server is not accepting connections"),
    HOST_NOT_FOUND("Database host not found"),
    AUTHENTICATION_FAILED("Authentication failed: check the database user name and password"),
    DATABASE_NOT_FOUND("Database not found"),
    TABLE_NOT_FOUND("Table not found"),
    SYNTAX_ERROR("SQL syntax error"),
    UNIQUE_CONSTRAINT_VIOLATION("Unique constraint violation"),
    FOREIGN_KEY_VIOLATION("Foreign key constraint violation"),
    TIMEOUT("Query timed out"),
    POOL_EXHAUSTED("No database connection available: the tenant's connection pool is exhausted"),
    RESULT_TOO_LARGE("Query result is too large"),
    DATABASE_ERROR("Database error");

    private final String defaultMessage;

    ExecutionErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
