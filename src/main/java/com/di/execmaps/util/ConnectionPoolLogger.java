package com.di.execmaps.util;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP connection pool statistics for the shard pools.
 * <p>Use at:
 * <ul>
 *   <li>Startup - pool creation (ShardDataSources)</li>
 *   <li>After the startup connectivity check (DataSourceStartupInitializer)</li>
 * </ul>
 */
@Slf4j
public final class ConnectionPoolLogger {

    /** Separator line to segregate connection/pool logs from the rest of the log output. */
    public static final String CONNECTION_LOG_SEPARATOR =
            "================================================================================";

    private ConnectionPoolLogger() {}

    /** Logs the start of a datasource/connection-pool section (separator + title). */
    public static void logDatasourceSectionStart(String title) {
        log.info(CONNECTION_LOG_SEPARATOR);
        log.info("[POOL] SHARD DATASOURCES  |  {}", title != null ? title : "");
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    /** Logs the end of a datasource/connection-pool section (separator). */
    public static void logDatasourceSectionEnd() {
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    /**
     * Reads pool statistics if the DataSource is a HikariCP pool.
     *
     * @return the snapshot, or {@code null} when the DataSource is not a started HikariCP pool
     */
    public static PoolStatsSnapshot snapshot(DataSource dataSource) {
        if (!(dataSource instanceof HikariDataSource hikari)) {
            return null;
        }
        HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
        if (pool == null) {
            return null;
        }
        return new PoolStatsSnapshot(hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                pool.getActiveConnections(), pool.getIdleConnections(), pool.getTotalConnections(),
                pool.getThreadsAwaitingConnection());
    }

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource
     * @param phase      description of when this is being logged (e.g. "startup", "shard 1 ready")
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        try {
            PoolStatsSnapshot stats = snapshot(dataSource);
            if (stats == null) {
                log.debug("Pool stats not available (not a started HikariCP pool): phase={}", phase);
                return;
            }
            log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                    phase, stats.poolName(), stats.maxPoolSize(), stats.minIdle(), stats.activeConnections(),
                    stats.idleConnections(), stats.totalConnections(), stats.threadsAwaitingConnection());
        } catch (RuntimeException e) {
            log.debug("Could not read pool stats for phase {}: {}", phase, e.getMessage());
        }
    }
}
