package com.askdb.query;

import java.util.List;
import java.util.Map;

/**
 * Result of one statement.
 *
 * @param rows rows in result order; each map keeps select-list column order
 * @param rowCount number of rows, or the update count for statements without a result set
 * @param elapsedMillis wall-clock time from just before pool acquisition to statement completion
 */
public record ExecutionOutcome(List<Map<String, Object>> rows, int rowCount, long elapsedMillis) {
}
