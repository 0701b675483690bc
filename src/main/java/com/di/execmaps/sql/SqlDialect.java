package com.di.execmaps.sql;

import com.di.execmaps.query.BoundStatement;
import com.di.execmaps.query.KeySetBinder;
import com.di.execmaps.query.NamedTemplate;
import com.di.execmaps.schema.MapSchema;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.time.temporal.ChronoUnit;
import java.util.Collection;

/**
 * Backend-specific pieces of the map statements. Everything else is generated generically.
 */
public interface SqlDialect {

    /** The dialect key used in configuration, e.g. "postgres". */
    String type();

    /**
     * Insert-or-replace statement for one row of the table, with named parameters equal to
     * the column names. A table without value columns ignores the conflicting row instead.
     */
    String upsert(MapSchema schema);

    /** Largest number of positional parameters a single statement may carry. */
    int maxBindParameters();

    /** Finest timestamp unit the backend stores without rounding. */
    default ChronoUnit timestampPrecision() {
        return ChronoUnit.MICROS;
    }

    /** Classpath location of the DDL for the map tables. */
    default String schemaScript() {
        return "schema/" + type() + "/execution_maps.sql";
    }

    /** Expands {@code :keysParam} into one bound parameter per key. */
    default BoundStatement bindKeySet(NamedTemplate template, MapSqlParameterSource params,
                                      String keysParam, Collection<?> keys) {
        return KeySetBinder.bind(template, params, keysParam, keys, maxBindParameters());
    }
}
