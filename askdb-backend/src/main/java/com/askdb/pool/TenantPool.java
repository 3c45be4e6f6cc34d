package com.askdb.pool;

import com.askdb.model.TenantConnectionTarget;
import com.askdb.query.QueryExecutionException;

import java.sql.Connection;
import java.time.Duration;

/**
 * Bounded set of live connections to one tenant's database.
 */
public interface TenantPool {

    TenantConnectionTarget target();

    default String tenantId() {
        return target().tenantId();
    }

    default String redactedTarget() {
        return target().redactedDsn();
    }

    /**
     * Borrow a connection, waiting up to the acquire timeout when the pool is at its cap.
     *
     * @return live connection; hand it back through {@link #release(Connection)}
     * @throws QueryExecutionException classified failure, {@code POOL_EXHAUSTED} when the wait timed out
     */
    Connection borrow();

    /**
     * Give a borrowed connection back. Null and already-closed connections are ignored.
     *
     * @param connection connection from {@link #borrow()}
     */
    void release(Connection connection);

    PoolStats stats();

    boolean isClosed();

    /**
     * Close the pool. Waits up to {@code drainTimeout} for borrowed connections to come back,
     * then aborts whatever is still out.
     *
     * @param drainTimeout grace period, zero to force-close immediately
     */
    void close(Duration drainTimeout);
}
