package com.di.execmaps.query;

import org.springframework.jdbc.core.namedparam.NamedParameterUtils;
import org.springframework.jdbc.core.namedparam.ParsedSql;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.util.Arrays;

/**
 * A statement written with named parameters ({@code :shard_id}), parsed once and reused.
 *
 * <p>{@link #jdbcSql()} is the fixed-arity JDBC form. Templates holding a collection parameter
 * are expanded per call by {@link KeySetBinder} instead.
 */
public final class NamedTemplate {

    private final String sql;
    private final ParsedSql parsed;
    private final String jdbcSql;

    private NamedTemplate(String sql) {
        this.sql = sql;
        this.parsed = NamedParameterUtils.parseSqlStatement(sql);
        this.jdbcSql = NamedParameterUtils.substituteNamedParameters(parsed, null);
    }

    public static NamedTemplate of(String sql) {
        return new NamedTemplate(sql);
    }

    /** The template text with named parameters. */
    public String sql() {
        return sql;
    }

    public ParsedSql parsed() {
        return parsed;
    }

    public String jdbcSql() {
        return jdbcSql;
    }

    /** Positional values for {@link #jdbcSql()}, in placeholder order. */
    public Object[] values(SqlParameterSource params) {
        return NamedParameterUtils.buildValueArray(parsed, params, null);
    }

    public BoundStatement bind(SqlParameterSource params) {
        return new BoundStatement(jdbcSql, Arrays.asList(values(params)));
    }

    @Override
    public String toString() {
        return sql;
    }
}
