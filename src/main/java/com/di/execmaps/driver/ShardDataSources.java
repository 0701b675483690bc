package com.di.execmaps.driver;

import com.di.execmaps.config.DbConfigSnapshot;
import com.di.execmaps.util.ConnectionPoolLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Owns one HikariCP pool per physical shard database.
 *
 * Pools are keyed by db shard index, so two shards pointing at the same URL still get separate
 * pools. Closing this object closes every pool it created.
 */
@Slf4j
public class ShardDataSources implements AutoCloseable {

    private final Map<Integer, HikariDataSource> pools = new ConcurrentSkipListMap<>();

    /**
     * Gets or creates the pool for the given shard.
     *
     * @param dbShardId physical shard index
     * @param snapshot  connection settings for that shard
     * @return DataSource for the shard
     */
    public DataSource getOrInit(int dbShardId, DbConfigSnapshot snapshot) {
        if (dbShardId < 0) {
            throw new IllegalArgumentException("dbShardId must be >= 0, got " + dbShardId);
        }
        return pools.computeIfAbsent(dbShardId, id -> {
            log.info("[POOL] Creating HikariCP DataSource for db shard {}: {} (user: {})",
                    id, sanitizeUrl(snapshot.jdbcUrl()), snapshot.username());

            int maxPool = Math.max(1, snapshot.maximumPoolSize());
            int minIdle = Math.max(0, Math.min(snapshot.minimumIdle(), maxPool));

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(maxPool);
            hikariConfig.setMinimumIdle(minIdle);
            if (snapshot.idleTimeoutMs() > 0) {
                hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            }
            if (snapshot.connectionTimeoutMs() > 0) {
                hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            }
            if (snapshot.maxLifetimeMs() > 0) {
                hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            }

            // Transactions are demarcated by DataSourceTransactionManager; single statements auto-commit
            hikariConfig.setAutoCommit(true);
            // Do not fail pool creation when a shard is down; the startup check reports it
            hikariConfig.setInitializationFailTimeout(-1);

            if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            }

            // Optional: leak detection for debugging (set -DHikariCP.leakDetectionThreshold=60000 to enable)
            String leakThreshold = System.getProperty("HikariCP.leakDetectionThreshold");
            if (leakThreshold != null && !leakThreshold.isEmpty()) {
                try {
                    hikariConfig.setLeakDetectionThreshold(Long.parseLong(leakThreshold));
                } catch (NumberFormatException e) {
                    log.warn("[POOL] Ignoring invalid HikariCP.leakDetectionThreshold '{}'", leakThreshold);
                }
            }

            hikariConfig.setPoolName(poolName(id, snapshot));

            HikariDataSource dataSource = new HikariDataSource(hikariConfig);
            log.info("[POOL] Created | pool={} | maxPoolSize={}, minIdle={}", dataSource.getPoolName(), maxPool, minIdle);
            return dataSource;
        });
    }

    /**
     * Creates pools for every shard, index i getting {@code snapshots.get(i)}.
     *
     * @return DataSources in db shard order
     */
    public List<DataSource> initAll(List<DbConfigSnapshot> snapshots) {
        ConnectionPoolLogger.logDatasourceSectionStart("Creating " + snapshots.size() + " shard pool(s)");
        List<DataSource> dataSources = new ArrayList<>(snapshots.size());
        for (int i = 0; i < snapshots.size(); i++) {
            dataSources.add(getOrInit(i, snapshots.get(i)));
        }
        ConnectionPoolLogger.logDatasourceSectionEnd();
        return dataSources;
    }

    /** DataSources in db shard order. */
    public List<DataSource> dataSources() {
        return new ArrayList<>(pools.values());
    }

    public int size() {
        return pools.size();
    }

    /**
     * Closes all pools and clears the cache.
     */
    public void closeAll() {
        log.info("[POOL] Closing all shard DataSources (count: {})", pools.size());
        pools.forEach((id, dataSource) -> {
            try {
                dataSource.close();
                log.debug("[POOL] Closed DataSource for db shard {}", id);
            } catch (RuntimeException e) {
                log.warn("[POOL] Error closing DataSource for db shard {}", id, e);
            }
        });
        pools.clear();
    }

    @Override
    public void close() {
        closeAll();
    }

    static String poolName(int dbShardId, DbConfigSnapshot snapshot) {
        return "execmaps-shard-" + dbShardId + "-" + generateShortPoolKey(snapshot);
    }

    /**
     * Short, readable pool key for monitoring (no password).
     * Extracts host, database, and username from JDBC URL.
     */
    static String generateShortPoolKey(DbConfigSnapshot snapshot) {
        String url = snapshot.jdbcUrl();
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        if (url == null || url.isBlank()) {
            return user.replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String safeUrl = sanitizeUrl(url);
        String part = safeUrl;
        int slashSlash = safeUrl.indexOf("//");
        if (slashSlash >= 0) {
            part = safeUrl.substring(slashSlash + 2);
        } else {
            // jdbc:h2:mem:name;OPTS
            int lastColon = safeUrl.lastIndexOf(':');
            part = "/" + safeUrl.substring(lastColon + 1);
        }
        int slashDb = part.indexOf("/");
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        safe = safe.replaceAll("^_|_$", "");
        return safe.isEmpty() ? "pool" : safe;
    }

    /**
     * Sanitizes JDBC URL for logging (masks passwords).
     */
    public static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
