package com.di.execmaps.schema;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Declarative description of one map table: its name, the map-key column and the ordered
 * value columns (identity and key columns excluded).
 *
 * <p>Names end up in generated SQL text, so they are restricted to plain identifiers.
 */
public record MapSchema(String tableName, String keyColumn, List<String> valueColumns) {

    /** Identity columns shared by every map table, in primary-key order. */
    public static final List<String> IDENTITY_COLUMNS = List.of("shard_id", "domain_id", "workflow_id", "run_id");

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    public MapSchema {
        requireIdentifier(tableName, "tableName");
        requireIdentifier(keyColumn, "keyColumn");
        Objects.requireNonNull(valueColumns, "valueColumns");
        valueColumns = List.copyOf(valueColumns);
        for (String column : valueColumns) {
            requireIdentifier(column, "valueColumns");
            if (column.equals(keyColumn) || IDENTITY_COLUMNS.contains(column)) {
                throw new IllegalArgumentException(
                        "Value column '" + column + "' of " + tableName + " collides with a primary-key column");
            }
        }
        if (IDENTITY_COLUMNS.contains(keyColumn)) {
            throw new IllegalArgumentException("Key column of " + tableName + " must not be an identity column");
        }
    }

    public boolean hasValueColumns() {
        return !valueColumns.isEmpty();
    }

    /** Primary-key columns: identity columns followed by the map key. */
    public List<String> primaryKeyColumns() {
        return List.of("shard_id", "domain_id", "workflow_id", "run_id", keyColumn);
    }

    /** Every column written by an upsert, in insertion order. */
    public List<String> allColumns() {
        return Stream.concat(primaryKeyColumns().stream(), valueColumns.stream()).toList();
    }

    private static void requireIdentifier(String name, String field) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException(field + " must be a lowercase SQL identifier, got '" + name + "'");
        }
    }
}
