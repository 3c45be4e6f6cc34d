package com.askdb.query;

import java.time.Duration;

/**
 * Executor limits.
 *
 * @param maxRows largest result the executor returns; more rows fail with {@code RESULT_TOO_LARGE}
 * @param statementTimeout per-statement timeout, zero for none
 */
public record QuerySettings(int maxRows, Duration statementTimeout) {

    public static final int DEFAULT_MAX_ROWS = 10_000;

    public QuerySettings {
        if (maxRows < 1) {
            throw new IllegalArgumentException("Max rows must be at least 1");
        }
        if (statementTimeout == null || statementTimeout.isNegative()) {
            throw new IllegalArgumentException("Statement timeout must not be negative");
        }
    }

    public static QuerySettings defaults() {
        return new QuerySettings(DEFAULT_MAX_ROWS, Duration.ofSeconds(10));
    }
}
