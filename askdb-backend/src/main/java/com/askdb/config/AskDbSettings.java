package com.askdb.config;

import com.askdb.pool.PoolSettings;
import com.askdb.query.QuerySettings;
import org.springframework.core.env.Environment;

import java.time.Duration;

/**
 * Runtime settings resolved from Spring properties, falling back to environment variables.
 *
 * @param pool per-tenant pool settings
 * @param query executor settings
 */
public record AskDbSettings(PoolSettings pool, QuerySettings query) {

    public static AskDbSettings fromEnvironment(Environment environment) {
        PoolSettings defaults = PoolSettings.defaults();
        PoolSettings pool = new PoolSettings(
                EnvironmentSettings.getInt(environment, "askdb.pool.max-size", "ASKDB_POOL_MAX_SIZE",
                        defaults.maxSize()),
                Duration.ofMillis(EnvironmentSettings.getLong(environment, "askdb.pool.idle-timeout-ms",
                        "ASKDB_POOL_IDLE_TIMEOUT_MS", defaults.idleTimeout().toMillis())),
                Duration.ofMillis(EnvironmentSettings.getLong(environment, "askdb.pool.acquire-timeout-ms",
                        "ASKDB_POOL_ACQUIRE_TIMEOUT_MS", defaults.acquireTimeout().toMillis())),
                Duration.ofMillis(EnvironmentSettings.getLong(environment, "askdb.pool.drain-timeout-ms",
                        "ASKDB_POOL_DRAIN_TIMEOUT_MS", defaults.drainTimeout().toMillis()))
        );

        QuerySettings queryDefaults = QuerySettings.defaults();
        QuerySettings query = new QuerySettings(
                EnvironmentSettings.getInt(environment, "askdb.query.max-rows", "ASKDB_QUERY_MAX_ROWS",
                        queryDefaults.maxRows()),
                Duration.ofMillis(EnvironmentSettings.getLong(environment, "askdb.query.statement-timeout-ms",
                        "ASKDB_QUERY_STATEMENT_TIMEOUT_MS", queryDefaults.statementTimeout().toMillis()))
        );
        return new AskDbSettings(pool, query);
    }
}
