package com.askdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatusResponse {
    private String tenantId;
    private int totalConnections;
    private int activeConnections;
    private int idleConnections;
    private int threadsAwaitingConnection;
    private Instant lastUsedAt;
}
