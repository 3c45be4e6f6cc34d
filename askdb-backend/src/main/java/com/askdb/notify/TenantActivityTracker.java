package com.askdb.notify;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers when each tenant last asked a question.
 */
@Component
public class TenantActivityTracker implements QueryCompletionListener {

    private final Map<String, Instant> lastUsed = new ConcurrentHashMap<>();

    @Override
    public void onCompletion(QueryCompletion completion) {
        if (completion.tenantId() == null || completion.finishedAt() == null) {
            return;
        }
        lastUsed.merge(completion.tenantId(), completion.finishedAt(),
                (a, b) -> a.isAfter(b) ? a : b);
    }

    public Optional<Instant> lastUsedAt(String tenantId) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lastUsed.get(tenantId));
    }
}
