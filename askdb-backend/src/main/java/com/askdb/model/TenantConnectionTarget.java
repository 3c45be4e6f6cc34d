package com.askdb.model;

import com.askdb.util.DsnRedactor;

import java.util.Objects;

/**
 * Database target of one tenant, supplied per call and never persisted.
 *
 * @param tenantId opaque tenant identifier
 * @param dsn connection descriptor; never log it, use {@link #redactedDsn()}
 */
public record TenantConnectionTarget(String tenantId, String dsn) {

    public TenantConnectionTarget {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("Tenant ID is required");
        }
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("Connection string must be a non-empty string");
        }
    }

    public String redactedDsn() {
        return DsnRedactor.redact(dsn);
    }

    /**
     * Whether this target points at the same database as {@code otherDsn}.
     *
     * @param otherDsn dsn
     * @return true when both DSNs are equal after trimming
     */
    public boolean sameDsn(String otherDsn) {
        return otherDsn != null && Objects.equals(dsn.trim(), otherDsn.trim());
    }

    @Override
    public String toString() {
        return "TenantConnectionTarget[tenantId=" + tenantId + ", dsn=" + redactedDsn() + "]";
    }
}
