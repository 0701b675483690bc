package com.di.execmaps.codec;

import com.di.execmaps.model.ExecutionMapRow;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Encodes and decodes the non-identity part of one map kind's rows.
 *
 * <p>Codecs work positionally against the table's {@link com.di.execmaps.schema.MapSchema}:
 * encoded values follow the schema's value-column order, and a select-all row carries the key
 * in column 1 followed by the value columns in that same order. Identity columns are handled
 * by the store.
 *
 * @param <R> row type
 * @param <K> map key type
 */
public interface MapRowCodec<R extends ExecutionMapRow, K> {

    K keyOf(R row);

    /** Value-column values in schema order; elements may be {@code null}. */
    List<Object> encodeValues(R row, DateTimeConverter converter);

    /** Reads key and values of the current result-set row; identity columns are left unset. */
    R decode(ResultSet rs, DateTimeConverter converter) throws SQLException;
}
