package com.di.execmaps.sql;

import com.di.execmaps.schema.MapSchema;
import org.springframework.stereotype.Component;

import static com.di.execmaps.query.SqlFragments.assignments;
import static com.di.execmaps.query.SqlFragments.columnList;
import static com.di.execmaps.query.SqlFragments.namedParameterList;

/**
 * MySQL 8: {@code INSERT ... ON DUPLICATE KEY UPDATE c = VALUES(c)}. Tables without value
 * columns absorb a key conflict with a no-op self-assignment of the key column; {@code INSERT IGNORE}
 * is not used since it also downgrades truncation and other errors to warnings.
 */
@Component
public class MySqlDialect implements SqlDialect {

    private static final int MAX_BIND_PARAMETERS = 65_535;

    @Override
    public String type() {
        return "mysql";
    }

    @Override
    public String upsert(MapSchema schema) {
        String columns = " (" + columnList(schema.allColumns()) + ")"
                + " VALUES (" + namedParameterList(schema.allColumns()) + ")";
        String insert = "INSERT INTO " + schema.tableName() + columns + " ON DUPLICATE KEY UPDATE ";
        if (!schema.hasValueColumns()) {
            return insert + schema.keyColumn() + " = " + schema.keyColumn();
        }
        return insert + assignments(schema.valueColumns(), "VALUES(%s)");
    }

    @Override
    public int maxBindParameters() {
        return MAX_BIND_PARAMETERS;
    }
}
