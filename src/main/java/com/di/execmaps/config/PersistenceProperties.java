package com.di.execmaps.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Shard layout and connection settings of the map store.
 *
 * <pre>
 * execmaps:
 *   persistence:
 *     dialect: postgres
 *     num-db-shards: 2
 *     default-operation-timeout: 10s
 *     shards:
 *       - jdbc-url: jdbc:postgresql://db0:5432/execmaps
 *         username: execmaps
 *         password: ...
 *       - jdbc-url: jdbc:postgresql://db1:5432/execmaps
 *         ...
 * </pre>
 */
@ConfigurationProperties(prefix = "execmaps.persistence")
public class PersistenceProperties {

    /** Registered dialect type: postgres or mysql (h2 is registered only on the test classpath). */
    private String dialect = "postgres";

    /** Number of physical shard databases; must match the size of {@link #shards}. 0 means "size of shards". */
    private int numDbShards;

    /** Query timeout applied when the caller's context has no deadline. Zero disables it. */
    private Duration defaultOperationTimeout = Duration.ofSeconds(10);

    private List<ShardConnection> shards = new ArrayList<>();

    private Schema schema = new Schema();

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        this.dialect = dialect;
    }

    public int getNumDbShards() {
        return numDbShards;
    }

    public void setNumDbShards(int numDbShards) {
        this.numDbShards = numDbShards;
    }

    public Duration getDefaultOperationTimeout() {
        return defaultOperationTimeout;
    }

    public void setDefaultOperationTimeout(Duration defaultOperationTimeout) {
        this.defaultOperationTimeout = defaultOperationTimeout;
    }

    public List<ShardConnection> getShards() {
        return shards;
    }

    public void setShards(List<ShardConnection> shards) {
        this.shards = shards;
    }

    public Schema getSchema() {
        return schema;
    }

    public void setSchema(Schema schema) {
        this.schema = schema;
    }

    /**
     * The physical shard count, checked against the configured connections.
     *
     * @throws IllegalStateException if no shard is configured or the counts disagree
     */
    public int resolveNumDbShards() {
        int configured = shards == null ? 0 : shards.size();
        if (configured == 0) {
            throw new IllegalStateException("execmaps.persistence.shards must list at least one shard database");
        }
        if (numDbShards != 0 && numDbShards != configured) {
            throw new IllegalStateException("execmaps.persistence.num-db-shards=" + numDbShards
                    + " but " + configured + " shard connection(s) are configured");
        }
        return configured;
    }

    public List<DbConfigSnapshot> toDbConfigSnapshots() {
        List<DbConfigSnapshot> snapshots = new ArrayList<>(shards.size());
        for (int i = 0; i < shards.size(); i++) {
            ShardConnection shard = shards.get(i);
            if (shard.getJdbcUrl() == null || shard.getJdbcUrl().isBlank()) {
                throw new IllegalStateException("execmaps.persistence.shards[" + i + "].jdbc-url is required");
            }
            snapshots.add(shard.toDbConfigSnapshot());
        }
        return snapshots;
    }

    public static class Schema {

        /** Apply the dialect's map-table DDL to every shard at startup. */
        private boolean autoCreate;

        public boolean isAutoCreate() {
            return autoCreate;
        }

        public void setAutoCreate(boolean autoCreate) {
            this.autoCreate = autoCreate;
        }
    }

    /** Connection and pool settings of one physical shard database. */
    public static class ShardConnection {

        private String jdbcUrl;
        private String username;
        private String password;
        private String driverClassName;
        private int maximumPoolSize = 10;
        private int minimumIdle = 1;
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration maxLifetime = Duration.ofMinutes(30);

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDriverClassName() {
            return driverClassName;
        }

        public void setDriverClassName(String driverClassName) {
            this.driverClassName = driverClassName;
        }

        public int getMaximumPoolSize() {
            return maximumPoolSize;
        }

        public void setMaximumPoolSize(int maximumPoolSize) {
            this.maximumPoolSize = maximumPoolSize;
        }

        public int getMinimumIdle() {
            return minimumIdle;
        }

        public void setMinimumIdle(int minimumIdle) {
            this.minimumIdle = minimumIdle;
        }

        public Duration getIdleTimeout() {
            return idleTimeout;
        }

        public void setIdleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public Duration getMaxLifetime() {
            return maxLifetime;
        }

        public void setMaxLifetime(Duration maxLifetime) {
            this.maxLifetime = maxLifetime;
        }

        public DbConfigSnapshot toDbConfigSnapshot() {
            return new DbConfigSnapshot(jdbcUrl, username, password, driverClassName,
                    maximumPoolSize, minimumIdle, toMillis(idleTimeout), toMillis(connectionTimeout),
                    toMillis(maxLifetime));
        }

        private static long toMillis(Duration duration) {
            return duration != null ? duration.toMillis() : 0L;
        }
    }
}
