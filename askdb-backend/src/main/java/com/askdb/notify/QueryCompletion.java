package com.askdb.notify;

import java.time.Instant;

/**
 * Summary of one finished question, published after the caller already has its answer.
 *
 * @param tenantId tenant identifier
 * @param question natural-language question
 * @param sql executed or rejected statement, null when none was generated
 * @param success whether rows were returned
 * @param rowCount rows returned, 0 on failure
 * @param elapsedMillis executor time, 0 when the statement never ran
 * @param errorKind failure kind name, null on success
 * @param finishedAt completion time
 */
public record QueryCompletion(
        String tenantId,
        String question,
        String sql,
        boolean success,
        int rowCount,
        long elapsedMillis,
        String errorKind,
        Instant finishedAt
) {
}
