package com.di.execmaps.sql;

import com.di.execmaps.schema.MapSchema;
import org.springframework.stereotype.Component;

import static com.di.execmaps.query.SqlFragments.assignments;
import static com.di.execmaps.query.SqlFragments.columnList;
import static com.di.execmaps.query.SqlFragments.namedParameterList;

/**
 * PostgreSQL: {@code INSERT ... ON CONFLICT (pk) DO UPDATE SET c = excluded.c}.
 */
@Component
public class PostgresDialect implements SqlDialect {

    /** The wire protocol carries the parameter count in a signed 16-bit field. */
    private static final int MAX_BIND_PARAMETERS = Short.MAX_VALUE;

    @Override
    public String type() {
        return "postgres";
    }

    @Override
    public String upsert(MapSchema schema) {
        String insert = "INSERT INTO " + schema.tableName()
                + " (" + columnList(schema.allColumns()) + ")"
                + " VALUES (" + namedParameterList(schema.allColumns()) + ")"
                + " ON CONFLICT (" + columnList(schema.primaryKeyColumns()) + ")";
        if (!schema.hasValueColumns()) {
            return insert + " DO NOTHING";
        }
        return insert + " DO UPDATE SET " + assignments(schema.valueColumns(), "excluded.%s");
    }

    @Override
    public int maxBindParameters() {
        return MAX_BIND_PARAMETERS;
    }
}
