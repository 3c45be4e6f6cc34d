package com.askdb.pool;

import com.askdb.model.TenantConnectionTarget;

/**
 * Builds the pool for a tenant. Implementations must not open connections eagerly.
 */
@FunctionalInterface
public interface TenantPoolFactory {

    TenantPool create(TenantConnectionTarget target, PoolSettings settings);
}
