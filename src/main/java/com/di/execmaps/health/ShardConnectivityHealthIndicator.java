package com.di.execmaps.health;

import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.util.ConnectionPoolLogger;
import com.di.execmaps.util.PoolStatsSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * UP when one pooled connection of every physical shard validates; DOWN otherwise, with the
 * per-shard result and pool statistics as details.
 */
@Slf4j
@Component("shardConnectivity")
@RequiredArgsConstructor
public class ShardConnectivityHealthIndicator implements HealthIndicator {

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final ShardedSqlDriver driver;

    @Override
    public Health health() {
        Map<String, Object> shards = new LinkedHashMap<>();
        boolean allUp = true;
        for (int dbShardId = 0; dbShardId < driver.physicalShardCount(); dbShardId++) {
            Map<String, Object> detail = new LinkedHashMap<>();
            try {
                boolean valid = driver.ping(dbShardId, VALIDATION_TIMEOUT_SECONDS);
                detail.put("status", valid ? "UP" : "DOWN");
                allUp &= valid;
            } catch (RuntimeException e) {
                log.debug("Health check of db shard {} failed: {}", dbShardId, e.getMessage());
                detail.put("status", "DOWN");
                detail.put("error", e.getMessage());
                allUp = false;
            }
            PoolStatsSnapshot stats = ConnectionPoolLogger.snapshot(driver.dataSource(dbShardId));
            if (stats != null) {
                detail.put("pool", stats);
            }
            shards.put("shard-" + dbShardId, detail);
        }
        Health.Builder builder = allUp ? Health.up() : Health.down();
        return builder.withDetail("physicalShards", driver.physicalShardCount())
                .withDetail("shards", shards)
                .build();
    }
}
