package com.di.execmaps.query;

import com.di.execmaps.schema.MapSchema;

/**
 * The four statements generated for one map table.
 *
 * @param schema       descriptor the statements were generated from
 * @param upsert       insert, replacing every non-key column on primary-key conflict
 * @param selectAll    key and value columns of every row of one execution
 * @param deleteByKeys rows of one execution whose key is in {@code :keys}
 * @param deleteAll    every row of one execution
 */
public record MapQueryTemplates(MapSchema schema,
                                NamedTemplate upsert,
                                NamedTemplate selectAll,
                                NamedTemplate deleteByKeys,
                                NamedTemplate deleteAll) {
}
