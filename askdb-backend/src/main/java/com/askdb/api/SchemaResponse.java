package com.askdb.api;

import com.askdb.schema.ColumnDescriptor;
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
public class SchemaResponse {
    private String tenantId;
    private int tableCount;
    private Map<String, List<ColumnDescriptor>> tables;
    private String traceId;
}
