package com.askdb.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tables of a tenant database, each with its columns, in the order the catalog returned them.
 */
public class SchemaMap {

    private final Map<String, List<ColumnDescriptor>> tables = new LinkedHashMap<>();

    public void addColumn(String tableName, ColumnDescriptor column) {
        tables.computeIfAbsent(tableName, t -> new ArrayList<>()).add(column);
    }

    public int tableCount() {
        return tables.size();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    /**
     * Read-only view of the tables.
     *
     * @return table name to ordered columns
     */
    public Map<String, List<ColumnDescriptor>> tables() {
        Map<String, List<ColumnDescriptor>> view = new LinkedHashMap<>();
        tables.forEach((table, columns) -> view.put(table, Collections.unmodifiableList(columns)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * Format the schema as model context, e.g.
     * <pre>
     * Table: users
     *   - id (integer) not null
     *   - email (text) nullable
     * </pre>
     * with a blank line between tables.
     *
     * @return formatted schema, empty when there are no tables
     */
    public String toPromptText() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, List<ColumnDescriptor>> e : tables.entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("Table: ").append(e.getKey()).append('\n');
            for (ColumnDescriptor c : e.getValue()) {
                sb.append("  - ").append(c.name())
                        .append(" (").append(c.dataType()).append(") ")
                        .append(c.nullable() ? "nullable" : "not null")
                        .append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaMap other)) {
            return false;
        }
        // order matters
        return new ArrayList<>(tables.entrySet()).equals(new ArrayList<>(other.tables.entrySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(tables);
    }

    @Override
    public String toString() {
        return "SchemaMap" + tables;
    }
}
