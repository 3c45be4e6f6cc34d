package com.askdb.pool;

import com.askdb.model.TenantConnectionTarget;
import com.askdb.query.SqlErrorClassifier;
import com.askdb.util.DsnRedactor;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

/**
 * {@link TenantPool} backed by a {@link HikariDataSource}.
 */
@Slf4j
public class HikariTenantPool implements TenantPool {

    private static final long DRAIN_POLL_MS = 50;

    private final TenantConnectionTarget target;
    private final HikariDataSource dataSource;

    public HikariTenantPool(TenantConnectionTarget target, HikariDataSource dataSource) {
        this.target = target;
        this.dataSource = dataSource;
    }

    @Override
    public TenantConnectionTarget target() {
        return target;
    }

    @Override
    public Connection borrow() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw SqlErrorClassifier.classify(e, target.dsn());
        }
    }

    @Override
    public void release(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            if (!connection.isClosed()) {
                connection.close();
            }
        } catch (SQLException e) {
            log.warn("Failed to release connection for tenant {}: {}",
                    target.tenantId(), DsnRedactor.scrub(e.getMessage(), target.dsn()));
        }
    }

    @Override
    public PoolStats stats() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool == null || dataSource.isClosed()) {
            return new PoolStats(target.tenantId(), 0, 0, 0, 0);
        }
        return new PoolStats(
                target.tenantId(),
                pool.getTotalConnections(),
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                pool.getThreadsAwaitingConnection()
        );
    }

    @Override
    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close(Duration drainTimeout) {
        if (dataSource.isClosed()) {
            return;
        }
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool != null && drainTimeout != null && !drainTimeout.isZero()) {
            long deadline = System.nanoTime() + drainTimeout.toNanos();
            while (pool.getActiveConnections() > 0 && System.nanoTime() < deadline) {
                try {
                    Thread.sleep(DRAIN_POLL_MS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Interrupted while draining pool for tenant {}; closing now", target.tenantId());
                    break;
                }
            }
        }
        int outstanding = pool != null ? pool.getActiveConnections() : 0;
        if (outstanding > 0) {
            log.warn("Force-closing pool for tenant {} with {} borrowed connection(s) outstanding",
                    target.tenantId(), outstanding);
        }
        // Hikari aborts connections that are still in use
        dataSource.close();
    }
}
