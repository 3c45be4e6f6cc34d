package com.askdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {
    private String sql;
    private String explanation;
    private List<Map<String, Object>> rows;
    private int rowCount;
    private long elapsedMillis;
    private String traceId;
}
