package com.di.execmaps.driver;

import com.di.execmaps.query.BoundStatement;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.jdbc.core.SqlProvider;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs statements against one of N physical shard databases.
 *
 * <p>Each shard gets its own {@link JdbcTemplate} and {@link TransactionTemplate}. Every call is
 * scoped to exactly one shard; there are no cross-shard transactions. SQL exceptions are
 * translated by Spring into {@link org.springframework.dao.DataAccessException}s.
 */
@Slf4j
public class ShardedSqlDriver {

    private static final String MDC_DB_SHARD = "dbShardId";

    private final List<Shard> shards;
    private final Duration defaultTimeout;

    public ShardedSqlDriver(List<DataSource> dataSources, Duration defaultTimeout) {
        if (dataSources == null || dataSources.isEmpty()) {
            throw new IllegalArgumentException("At least one shard DataSource is required");
        }
        List<Shard> built = new ArrayList<>(dataSources.size());
        for (DataSource dataSource : dataSources) {
            built.add(new Shard(dataSource, new JdbcTemplate(dataSource),
                    new TransactionTemplate(new DataSourceTransactionManager(dataSource))));
        }
        this.shards = Collections.unmodifiableList(built);
        this.defaultTimeout = defaultTimeout;
    }

    public int physicalShardCount() {
        return shards.size();
    }

    public DataSource dataSource(int dbShardId) {
        return shard(dbShardId).dataSource();
    }

    /**
     * Executes {@code sql} once per argument array as a single JDBC batch inside one local
     * transaction on the shard. Either every row commits or none does.
     *
     * @return sum of the reported update counts; drivers that report
     *         {@link Statement#SUCCESS_NO_INFO} contribute nothing
     */
    public long executeBatch(OperationContext ctx, int dbShardId, String sql, List<Object[]> batchArgs) {
        ctx.checkActive();
        Shard shard = shard(dbShardId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_DB_SHARD, String.valueOf(dbShardId))) {
            Long affected = shard.tx().execute(status -> shard.jdbc().execute(new SimpleStatementCreator(sql),
                    (PreparedStatementCallback<Long>) ps -> {
                        ctx.applyTo(ps, defaultTimeout);
                        ctx.attach(ps);
                        try {
                            for (Object[] args : batchArgs) {
                                new ArgumentPreparedStatementSetter(args).setValues(ps);
                                ps.addBatch();
                            }
                            return sumAffected(ps.executeBatch());
                        } finally {
                            ctx.detach(ps);
                        }
                    }));
            log.debug("[MAPS] Batch of {} committed on db shard {}", batchArgs.size(), dbShardId);
            return affected != null ? affected : 0L;
        }
    }

    public long update(OperationContext ctx, int dbShardId, BoundStatement statement) {
        ctx.checkActive();
        Shard shard = shard(dbShardId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_DB_SHARD, String.valueOf(dbShardId))) {
            Long affected = shard.jdbc().execute(new SimpleStatementCreator(statement.sql()),
                    (PreparedStatementCallback<Long>) ps -> {
                        ctx.applyTo(ps, defaultTimeout);
                        new ArgumentPreparedStatementSetter(statement.argArray()).setValues(ps);
                        ctx.attach(ps);
                        try {
                            return (long) ps.executeUpdate();
                        } finally {
                            ctx.detach(ps);
                        }
                    });
            return affected != null ? affected : 0L;
        }
    }

    public <T> List<T> query(OperationContext ctx, int dbShardId, BoundStatement statement, RowMapper<T> rowMapper) {
        ctx.checkActive();
        Shard shard = shard(dbShardId);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_DB_SHARD, String.valueOf(dbShardId))) {
            List<T> rows = shard.jdbc().execute(new SimpleStatementCreator(statement.sql()),
                    (PreparedStatementCallback<List<T>>) ps -> {
                        ctx.applyTo(ps, defaultTimeout);
                        new ArgumentPreparedStatementSetter(statement.argArray()).setValues(ps);
                        ctx.attach(ps);
                        try (ResultSet rs = ps.executeQuery()) {
                            return new RowMapperResultSetExtractor<>(rowMapper).extractData(rs);
                        } finally {
                            ctx.detach(ps);
                        }
                    });
            return rows != null ? rows : List.of();
        }
    }

    /** Validates one pooled connection of the shard. */
    public boolean ping(int dbShardId, int timeoutSeconds) {
        Boolean valid = shard(dbShardId).jdbc().execute((ConnectionCallback<Boolean>) con -> con.isValid(timeoutSeconds));
        return Boolean.TRUE.equals(valid);
    }

    static long sumAffected(int[] counts) {
        long total = 0;
        for (int count : counts) {
            if (count > 0) {
                total += count;
            }
        }
        return total;
    }

    private Shard shard(int dbShardId) {
        if (dbShardId < 0 || dbShardId >= shards.size()) {
            throw new IllegalArgumentException("dbShardId " + dbShardId + " out of range [0, " + shards.size() + ")");
        }
        return shards.get(dbShardId);
    }

    private record Shard(DataSource dataSource, JdbcTemplate jdbc, TransactionTemplate tx) {
    }

    private static final class SimpleStatementCreator implements PreparedStatementCreator, SqlProvider {

        private final String sql;

        SimpleStatementCreator(String sql) {
            this.sql = sql;
        }

        @Override
        public PreparedStatement createPreparedStatement(Connection con) throws SQLException {
            return con.prepareStatement(sql);
        }

        @Override
        public String getSql() {
            return sql;
        }
    }
}
