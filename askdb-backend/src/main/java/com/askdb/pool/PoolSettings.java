package com.askdb.pool;

import java.time.Duration;

/**
 * Limits applied to every tenant pool.
 *
 * @param maxSize hard cap on live connections per tenant
 * @param idleTimeout how long an idle connection is kept
 * @param acquireTimeout how long a borrower waits for a connection before the pool reports exhaustion
 * @param drainTimeout how long closing waits for borrowed connections before force-closing them
 */
public record PoolSettings(int maxSize, Duration idleTimeout, Duration acquireTimeout, Duration drainTimeout) {

    public static final int DEFAULT_MAX_SIZE = 10;

    public PoolSettings {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Pool max size must be at least 1");
        }
        if (idleTimeout == null || acquireTimeout == null || drainTimeout == null) {
            throw new IllegalArgumentException("Pool timeouts are required");
        }
        if (drainTimeout.isNegative()) {
            throw new IllegalArgumentException("Drain timeout must not be negative");
        }
    }

    public static PoolSettings defaults() {
        return new PoolSettings(DEFAULT_MAX_SIZE, Duration.ofSeconds(30), Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    public PoolSettings withMaxSize(int newMaxSize) {
        return new PoolSettings(newMaxSize, idleTimeout, acquireTimeout, drainTimeout);
    }
}
