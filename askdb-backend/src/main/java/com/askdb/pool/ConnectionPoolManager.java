package com.askdb.pool;

import com.askdb.model.TenantConnectionTarget;
import com.askdb.query.ExecutionErrorKind;
import com.askdb.query.QueryExecutionException;
import com.askdb.query.SqlErrorClassifier;
import com.askdb.util.DsnRedactor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns one connection pool per tenant.
 *
 * <p>Pools are created lazily on first use. Concurrent first use for the same tenant builds
 * exactly one pool; every caller gets that pool. Closing a pool removes it from the map before
 * draining it, so a request arriving during the drain builds a fresh pool instead of borrowing
 * from the closing one.
 *
 * <p>DSNs never reach logs or exception messages; only their redacted form does.
 */
@Slf4j
public class ConnectionPoolManager {

    private static final int VALIDATION_TIMEOUT_SECONDS = 5;

    private final Map<String, TenantPool> pools = new ConcurrentHashMap<>();
    private final TenantPoolFactory poolFactory;
    private final PoolSettings settings;
    private final AtomicLong probeCounter = new AtomicLong();

    /**
     * Create a pool manager.
     *
     * @param poolFactory strategy used to build a tenant pool
     * @param settings limits applied to every pool
     */
    public ConnectionPoolManager(TenantPoolFactory poolFactory, PoolSettings settings) {
        this.poolFactory = poolFactory;
        this.settings = settings;
    }

    /**
     * Get the tenant's pool, creating it on first use.
     *
     * <p>The first DSN seen for a tenant wins. A later call with a different DSN keeps the
     * existing pool and logs a warning; close the pool to switch targets.
     *
     * @param tenantId tenant identifier
     * @param dsn tenant DSN
     * @return the tenant's pool
     * @throws IllegalArgumentException when the tenant id or DSN is blank or the DSN is malformed
     */
    public TenantPool acquire(String tenantId, String dsn) {
        TenantConnectionTarget target = new TenantConnectionTarget(tenantId, dsn);
        TenantPool pool = pools.computeIfAbsent(tenantId, id -> createPool(target));
        if (!pool.target().sameDsn(dsn)) {
            log.warn("Tenant {} already has a pool for {}; ignoring new target {}",
                    tenantId, pool.redactedTarget(), target.redactedDsn());
        }
        return pool;
    }

    /**
     * Return a borrowed connection to its pool. Never throws for closed connections.
     *
     * @param pool pool the connection came from, may be null
     * @param connection connection, may be null
     */
    public void releaseConnection(TenantPool pool, Connection connection) {
        if (pool == null || connection == null) {
            return;
        }
        pool.release(connection);
    }

    /**
     * Close a tenant's pool, draining borrowed connections up to the drain timeout.
     *
     * @param tenantId tenant identifier
     * @return false when the tenant had no pool
     */
    public boolean closePool(String tenantId) {
        if (tenantId == null) {
            return false;
        }
        TenantPool pool = pools.remove(tenantId);
        if (pool == null) {
            return false;
        }
        pool.close(settings.drainTimeout());
        log.info("Closed connection pool for tenant {}", tenantId);
        return true;
    }

    /**
     * Close every pool. All pools share one drain deadline. A failing pool does not stop the
     * sweep; its error is collected instead.
     *
     * <p>Idempotent. Registered as the bean's destroy method.
     *
     * @return one redacted message per pool that failed to close
     */
    public List<String> closeAll() {
        List<String> errors = new ArrayList<>();
        long deadline = System.nanoTime() + settings.drainTimeout().toNanos();
        int closed = 0;
        for (String tenantId : new ArrayList<>(pools.keySet())) {
            TenantPool pool = pools.remove(tenantId);
            if (pool == null) {
                continue;
            }
            Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
            try {
                pool.close(remaining);
                closed++;
            } catch (RuntimeException e) {
                String message = "Failed to close pool for tenant " + tenantId + " ("
                        + pool.redactedTarget() + "): "
                        + DsnRedactor.scrub(String.valueOf(e.getMessage()), pool.target().dsn());
                log.warn(message);
                errors.add(message);
            }
        }
        if (closed > 0 || !errors.isEmpty()) {
            log.info("Closed {} connection pool(s), {} failure(s)", closed, errors.size());
        }
        return errors;
    }

    /**
     * Tenants that currently own a pool.
     *
     * @return sorted, unmodifiable snapshot
     */
    public Set<String> activeTenants() {
        return Collections.unmodifiableSet(new TreeSet<>(pools.keySet()));
    }

    public Optional<PoolStats> stats(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(pools.get(tenantId)).map(TenantPool::stats);
    }

    /**
     * Open and validate one connection through a throw-away pool of size one.
     *
     * @param dsn DSN to test
     * @throws QueryExecutionException classified failure
     */
    public void testConnection(String dsn) {
        TenantConnectionTarget target = new TenantConnectionTarget(
                "connection-test-" + probeCounter.incrementAndGet(), dsn);
        log.info("Testing connection to {}", target.redactedDsn());

        TenantPool probe = poolFactory.create(target, settings.withMaxSize(1));
        try {
            Connection connection = probe.borrow();
            try {
                if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
                    throw new QueryExecutionException(ExecutionErrorKind.DATABASE_ERROR, "Connection is not valid");
                }
            } catch (SQLException e) {
                throw SqlErrorClassifier.classify(e, dsn);
            } finally {
                probe.release(connection);
            }
            log.info("Test connection to {} succeeded", target.redactedDsn());
        } catch (QueryExecutionException e) {
            log.warn("Test connection to {} failed (kind={}, sql_state={})",
                    target.redactedDsn(), e.getKind(), e.getSqlState());
            throw e;
        } finally {
            probe.close(Duration.ZERO);
        }
    }

    private TenantPool createPool(TenantConnectionTarget target) {
        TenantPool pool = poolFactory.create(target, settings);
        log.info("Created connection pool for tenant {} ({}, max_size={})",
                target.tenantId(), target.redactedDsn(), settings.maxSize());
        return pool;
    }
}
