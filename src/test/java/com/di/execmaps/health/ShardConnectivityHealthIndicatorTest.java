package com.di.execmaps.health;

import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.support.H2Shards;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.jdbc.datasource.AbstractDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShardConnectivityHealthIndicator Tests")
class ShardConnectivityHealthIndicatorTest {

    private H2Shards shards;

    @BeforeEach
    void setUp() {
        shards = H2Shards.withoutSchema(2);
    }

    @AfterEach
    void tearDown() {
        shards.close();
    }

    @Test
    @DisplayName("Should report UP with one entry per reachable shard")
    @SuppressWarnings("unchecked")
    void testAllShardsUp() {
        ShardedSqlDriver driver = new ShardedSqlDriver(shards.dataSources(), Duration.ofSeconds(5));
        Health health = new ShardConnectivityHealthIndicator(driver).health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(2, health.getDetails().get("physicalShards"));
        Map<String, Object> perShard = (Map<String, Object>) health.getDetails().get("shards");
        assertEquals(2, perShard.size());
        Map<String, Object> first = (Map<String, Object>) perShard.get("shard-0");
        assertEquals("UP", first.get("status"));
        assertNotNull(first.get("pool"));
    }

    @Test
    @DisplayName("Should report DOWN when any shard cannot hand out a connection")
    @SuppressWarnings("unchecked")
    void testOneShardDown() {
        ShardedSqlDriver driver = new ShardedSqlDriver(List.of(shards.get(0), new UnreachableDataSource()),
                Duration.ofSeconds(5));
        Health health = new ShardConnectivityHealthIndicator(driver).health();

        assertEquals(Status.DOWN, health.getStatus());
        Map<String, Object> perShard = (Map<String, Object>) health.getDetails().get("shards");
        assertEquals("UP", ((Map<String, Object>) perShard.get("shard-0")).get("status"));
        Map<String, Object> broken = (Map<String, Object>) perShard.get("shard-1");
        assertEquals("DOWN", broken.get("status"));
        assertNotNull(broken.get("error"));
        assertFalse(broken.containsKey("pool"));
    }

    private static final class UnreachableDataSource extends AbstractDataSource {

        @Override
        public Connection getConnection() throws SQLException {
            throw new SQLException("connection refused", "08001");
        }

        @Override
        public Connection getConnection(String username, String password) throws SQLException {
            return getConnection();
        }
    }
}
