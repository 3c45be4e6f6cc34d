package com.askdb.query;

import java.util.List;
import java.util.Map;

/**
 * Answer to a question on the non-streaming path.
 */
public record QueryAnswer(
        String sql,
        String explanation,
        List<Map<String, Object>> rows,
        int rowCount,
        long elapsedMillis
) {
}
