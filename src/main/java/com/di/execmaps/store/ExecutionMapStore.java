package com.di.execmaps.store;

import com.di.execmaps.codec.DateTimeConverter;
import com.di.execmaps.codec.MapRowCodec;
import com.di.execmaps.codec.UuidCodec;
import com.di.execmaps.driver.OperationContext;
import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.model.ExecutionMapRow;
import com.di.execmaps.model.ExecutionMapsFilter;
import com.di.execmaps.model.WriteResult;
import com.di.execmaps.query.BoundStatement;
import com.di.execmaps.query.MapQueryTemplateGenerator;
import com.di.execmaps.query.MapQueryTemplates;
import com.di.execmaps.schema.MapKind;
import com.di.execmaps.schema.MapSchema;
import com.di.execmaps.sharding.ShardRouter;
import com.di.execmaps.sql.SqlDialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Replace / select / delete for one map kind, driven entirely by the kind's generated
 * templates and its row codec.
 *
 * <p>Stateless apart from its immutable collaborators; safe for concurrent use.
 *
 * @param <R> row type
 * @param <K> map key type
 */
@Slf4j
public class ExecutionMapStore<R extends ExecutionMapRow, K> {

    private final MapKind kind;
    private final MapQueryTemplates templates;
    private final MapRowCodec<R, K> codec;
    private final SqlDialect dialect;
    private final DateTimeConverter converter;
    private final ShardRouter router;
    private final ShardedSqlDriver driver;

    public ExecutionMapStore(MapKind kind,
                             MapQueryTemplates templates,
                             MapRowCodec<R, K> codec,
                             SqlDialect dialect,
                             ShardRouter router,
                             ShardedSqlDriver driver) {
        this.kind = kind;
        this.templates = templates;
        this.codec = codec;
        this.dialect = dialect;
        this.converter = new DateTimeConverter(dialect.timestampPrecision());
        this.router = router;
        this.driver = driver;
    }

    /**
     * Upserts every row in one transaction on the physical shard of the first row.
     *
     * @throws IllegalArgumentException if a row is {@code null} or resolves to another physical shard
     */
    public WriteResult replace(OperationContext ctx, List<R> rows) {
        if (rows == null || rows.isEmpty()) {
            return WriteResult.noOp();
        }
        Objects.requireNonNull(ctx, "ctx");
        R first = requireRow(rows.get(0), 0);
        int dbShardId = router.resolve(first.getShardId());

        List<Object[]> batch = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            R row = requireRow(rows.get(i), i);
            int rowDbShard = router.resolve(row.getShardId());
            if (rowDbShard != dbShardId) {
                throw new IllegalArgumentException(String.format(
                        "%s row %d (shardId=%d) resolves to db shard %d but the batch targets db shard %d",
                        kind.tag(), i, row.getShardId(), rowDbShard, dbShardId));
            }
            batch.add(templates.upsert().values(rowParameters(row)));
        }

        long affected = driver.executeBatch(ctx, dbShardId, templates.upsert().jdbcSql(), batch);
        log.debug("[MAPS] {} replace: {} row(s) on db shard {}, affected={}", kind.tag(), rows.size(), dbShardId, affected);
        return WriteResult.of(affected);
    }

    /**
     * All rows of the execution, with identity fields taken from {@code filter}. No ordering.
     */
    public List<R> select(OperationContext ctx, ExecutionMapsFilter filter) {
        Objects.requireNonNull(ctx, "ctx");
        requireFilter(filter);
        int dbShardId = router.resolve(filter.getShardId());
        BoundStatement statement = templates.selectAll().bind(identityParameters(filter));
        return driver.query(ctx, dbShardId, statement, (rs, rowNum) -> {
            R row = codec.decode(rs, converter);
            row.reattachIdentity(filter);
            return row;
        });
    }

    /**
     * Deletes rows of the execution.
     *
     * @param keys {@code null} deletes every row of the execution; an empty collection does
     *             nothing and runs no statement; otherwise only rows whose key is in the set
     */
    public WriteResult delete(OperationContext ctx, ExecutionMapsFilter filter, Collection<K> keys) {
        if (keys == null) {
            return deleteAll(ctx, filter);
        }
        requireFilter(filter);
        if (keys.isEmpty()) {
            return WriteResult.noOp();
        }
        Objects.requireNonNull(ctx, "ctx");
        int dbShardId = router.resolve(filter.getShardId());
        BoundStatement statement = dialect.bindKeySet(templates.deleteByKeys(), identityParameters(filter),
                MapQueryTemplateGenerator.KEYS_PARAM, keys);
        long affected = driver.update(ctx, dbShardId, statement);
        log.debug("[MAPS] {} delete of {} key(s) on db shard {}, affected={}", kind.tag(), keys.size(), dbShardId, affected);
        return WriteResult.of(affected);
    }

    public WriteResult deleteAll(OperationContext ctx, ExecutionMapsFilter filter) {
        Objects.requireNonNull(ctx, "ctx");
        requireFilter(filter);
        int dbShardId = router.resolve(filter.getShardId());
        long affected = driver.update(ctx, dbShardId, templates.deleteAll().bind(identityParameters(filter)));
        log.debug("[MAPS] {} delete-all on db shard {}, affected={}", kind.tag(), dbShardId, affected);
        return WriteResult.of(affected);
    }

    MapSqlParameterSource rowParameters(R row) {
        MapSchema schema = templates.schema();
        MapSqlParameterSource params = identityParameters(ExecutionMapsFilter.forRow(row))
                .addValue(schema.keyColumn(), codec.keyOf(row));
        List<Object> values = codec.encodeValues(row, converter);
        if (values.size() != schema.valueColumns().size()) {
            throw new IllegalStateException(String.format("%s codec produced %d value(s) for %d column(s)",
                    kind.tag(), values.size(), schema.valueColumns().size()));
        }
        for (int i = 0; i < values.size(); i++) {
            params.addValue(schema.valueColumns().get(i), values.get(i));
        }
        return params;
    }

    static MapSqlParameterSource identityParameters(ExecutionMapsFilter filter) {
        return new MapSqlParameterSource()
                .addValue("shard_id", filter.getShardId())
                .addValue("domain_id", UuidCodec.toBytes(filter.getDomainId()))
                .addValue("workflow_id", filter.getWorkflowId())
                .addValue("run_id", UuidCodec.toBytes(filter.getRunId()));
    }

    private R requireRow(R row, int index) {
        if (row == null) {
            throw new IllegalArgumentException(kind.tag() + " row " + index + " is null");
        }
        if (row.getDomainId() == null || row.getWorkflowId() == null || row.getRunId() == null) {
            throw new IllegalArgumentException(kind.tag() + " row " + index + " is missing its execution identity");
        }
        return row;
    }

    private static void requireFilter(ExecutionMapsFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
    }
}
