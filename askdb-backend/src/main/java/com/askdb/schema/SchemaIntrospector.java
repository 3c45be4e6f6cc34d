package com.askdb.schema;

import com.askdb.query.ExecutionOutcome;
import com.askdb.query.QueryExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Reads the public schema of a tenant database. Nothing is cached; the target may change
 * between calls.
 */
@Slf4j
@Service
public class SchemaIntrospector {

    static final String SCHEMA_QUERY = "SELECT table_name, column_name, data_type, is_nullable "
            + "FROM information_schema.columns "
            + "WHERE table_schema = 'public' "
            + "ORDER BY table_name, ordinal_position";

    private final QueryExecutor queryExecutor;

    public SchemaIntrospector(QueryExecutor queryExecutor) {
        this.queryExecutor = queryExecutor;
    }

    /**
     * Fetch the schema.
     *
     * @param tenantId tenant identifier
     * @param dsn tenant DSN
     * @return tables and columns in catalog order
     * @throws com.askdb.query.QueryExecutionException as reported by the executor
     */
    public SchemaMap fetchSchema(String tenantId, String dsn) {
        ExecutionOutcome outcome = queryExecutor.execute(tenantId, dsn, SCHEMA_QUERY);
        SchemaMap schema = new SchemaMap();
        for (Map<String, Object> row : outcome.rows()) {
            String table = text(row, "table_name");
            String nullable = text(row, "is_nullable");
            schema.addColumn(table, new ColumnDescriptor(
                    text(row, "column_name"),
                    text(row, "data_type"),
                    "YES".equalsIgnoreCase(nullable)
            ));
        }
        log.debug("Fetched schema for tenant {}: {} table(s)", tenantId, schema.tableCount());
        return schema;
    }

    // drivers differ in label case
    private static String text(Map<String, Object> row, String column) {
        Object v = row.get(column);
        if (v == null) {
            for (Map.Entry<String, Object> e : row.entrySet()) {
                if (e.getKey() != null && e.getKey().equalsIgnoreCase(column)) {
                    v = e.getValue();
                    break;
                }
            }
        }
        return v != null ? v.toString() : null;
    }
}
