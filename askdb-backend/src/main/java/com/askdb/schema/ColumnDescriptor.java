package com.askdb.schema;

/**
 * One column of a table.
 *
 * @param name column name
 * @param dataType type name as reported by the catalog
 * @param nullable whether the column accepts nulls
 */
public record ColumnDescriptor(String name, String dataType, boolean nullable) {
}
