package com.askdb.pool;

import com.askdb.model.TenantConnectionTarget;
import com.askdb.query.ExecutionErrorKind;
import com.askdb.query.QueryExecutionException;
import com.askdb.util.DsnParser;
import com.askdb.util.DsnRedactor;
import com.askdb.util.JdbcConnectionInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.util.Map;

/**
 * Builds HikariCP pools for tenant databases.
 *
 * <p>Pools start empty ({@code initializationFailTimeout = -1}), so creating one never touches
 * the network; the first borrow opens the first connection. Connections are read-only.
 */
public class HikariTenantPoolFactory implements TenantPoolFactory {

    static final String APPLICATION_NAME = "askdb";
    static final String POOL_NAME_PREFIX = "askdb-";
    private static final long MIN_CONNECTION_TIMEOUT_MS = 250;
    private static final long MAX_VALIDATION_TIMEOUT_MS = 5000;

    @Override
    public TenantPool create(TenantConnectionTarget target, PoolSettings settings) {
        JdbcConnectionInfo info = DsnParser.parse(target.dsn());
        HikariConfig config = buildHikariConfig(target, info, settings);
        try {
            return new HikariTenantPool(target, new HikariDataSource(config));
        } catch (RuntimeException e) {
            // Hikari puts the JDBC URL into driver lookup failures; the cause is dropped on purpose
            throw new QueryExecutionException(
                    ExecutionErrorKind.DATABASE_ERROR,
                    "Failed to create connection pool: " + DsnRedactor.scrub(e.getMessage(), target.dsn())
            );
        }
    }

    HikariConfig buildHikariConfig(TenantConnectionTarget target, JdbcConnectionInfo info, PoolSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        config.setJdbcUrl(info.getUrl());
        if (info.getUsername() != null && !info.getUsername().isEmpty()) {
            config.setUsername(info.getUsername());
        }
        if (info.getPassword() != null && !info.getPassword().isEmpty()) {
            config.setPassword(info.getPassword());
        }

        if ("postgres".equalsIgnoreCase(info.getDbType())) {
            config.setDriverClassName("org.postgresql.Driver");
            // Shows up as pg_stat_activity.application_name
            config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
            for (Map.Entry<String, String> e : info.getProperties().entrySet()) {
                config.addDataSourceProperty(e.getKey(), e.getValue());
            }
        }

        long acquireMs = Math.max(MIN_CONNECTION_TIMEOUT_MS, settings.acquireTimeout().toMillis());
        config.setPoolName(POOL_NAME_PREFIX + target.tenantId());
        config.setMaximumPoolSize(settings.maxSize());
        config.setMinimumIdle(0);
        config.setIdleTimeout(settings.idleTimeout().toMillis());
        config.setConnectionTimeout(acquireMs);
        config.setValidationTimeout(Math.min(acquireMs, MAX_VALIDATION_TIMEOUT_MS));
        config.setInitializationFailTimeout(-1);
        config.setReadOnly(true);
        return config;
    }
}
