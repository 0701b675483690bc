package com.di.execmaps.query;

import com.di.execmaps.schema.MapSchema;
import com.di.execmaps.sql.SqlDialect;

import java.util.ArrayList;
import java.util.List;

import static com.di.execmaps.query.SqlFragments.columnList;
import static com.di.execmaps.query.SqlFragments.identityPredicate;

/**
 * Builds the statements of a map table from its {@link MapSchema}. Only registry-defined
 * identifiers are written into SQL text; every value is a named parameter.
 */
public final class MapQueryTemplateGenerator {

    /** Name of the collection parameter of the delete-by-key-set statement. */
    public static final String KEYS_PARAM = "keys";

    private MapQueryTemplateGenerator() {
    }

    public static MapQueryTemplates generate(MapSchema schema, SqlDialect dialect) {
        return new MapQueryTemplates(
                schema,
                NamedTemplate.of(dialect.upsert(schema)),
                NamedTemplate.of(selectAll(schema)),
                NamedTemplate.of(deleteByKeys(schema)),
                NamedTemplate.of(deleteAll(schema)));
    }

    static String selectAll(MapSchema schema) {
        List<String> columns = new ArrayList<>();
        columns.add(schema.keyColumn());
        columns.addAll(schema.valueColumns());
        return "SELECT " + columnList(columns) + " FROM " + schema.tableName()
                + " WHERE " + identityPredicate();
    }

    static String deleteByKeys(MapSchema schema) {
        return "DELETE FROM " + schema.tableName()
                + " WHERE " + identityPredicate()
                + " AND " + schema.keyColumn() + " IN (:" + KEYS_PARAM + ")";
    }

    static String deleteAll(MapSchema schema) {
        return "DELETE FROM " + schema.tableName() + " WHERE " + identityPredicate();
    }
}
