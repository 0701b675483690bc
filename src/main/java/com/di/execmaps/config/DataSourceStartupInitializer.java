package com.di.execmaps.config;

import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.query.MapQueryTemplateCatalog;
import com.di.execmaps.sql.SchemaScripts;
import com.di.execmaps.util.ConnectionPoolLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * At startup, checks every physical shard sequentially, applies the map-table DDL when
 * {@code execmaps.persistence.schema.auto-create} is set, and logs a failure/success summary.
 * A shard that is down does not stop the application; its operations fail until it is back.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class DataSourceStartupInitializer implements ApplicationRunner {

    private static final int PING_TIMEOUT_SECONDS = 5;

    private final ShardedSqlDriver driver;
    private final MapQueryTemplateCatalog catalog;
    private final PersistenceProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        int shardCount = driver.physicalShardCount();
        ConnectionPoolLogger.logDatasourceSectionStart("Checking " + shardCount + " shard database(s)");

        Map<Integer, String> failures = new LinkedHashMap<>();
        for (int dbShardId = 0; dbShardId < shardCount; dbShardId++) {
            int step = dbShardId + 1;
            log.info("[DS-STARTUP] Shard {}/{}: checking db shard {}", step, shardCount, dbShardId);
            String failure = initShard(dbShardId);
            if (failure != null) {
                failures.put(dbShardId, failure);
                log.warn("[DS-STARTUP] Shard {}/{}: db shard {} failed (see error above)", step, shardCount, dbShardId);
            } else {
                log.info("[DS-STARTUP] Shard {}/{}: db shard {} ready", step, shardCount, dbShardId);
                ConnectionPoolLogger.logPoolStats(driver.dataSource(dbShardId), "db shard " + dbShardId + " ready");
            }
        }

        if (!failures.isEmpty()) {
            log.error("[DS-STARTUP] Shard check finished with {} failure(s):", failures.size());
            failures.forEach((id, message) -> log.error("[DS-STARTUP]   - db shard {}: {}. Check execmaps.persistence.shards[{}]",
                    id, message, id));
        }
        List<Integer> ready = new ArrayList<>();
        for (int dbShardId = 0; dbShardId < shardCount; dbShardId++) {
            if (!failures.containsKey(dbShardId)) {
                ready.add(dbShardId);
            }
        }
        log.info("[DS-STARTUP] Shard summary: {} ready ({}), {} failed ({})",
                ready.size(), ready, failures.size(), new ArrayList<>(failures.keySet()));
        ConnectionPoolLogger.logDatasourceSectionEnd();
    }

    /** @return null on success, otherwise the failure message */
    private String initShard(int dbShardId) {
        try {
            if (!driver.ping(dbShardId, PING_TIMEOUT_SECONDS)) {
                return "connection validation failed";
            }
            if (properties.getSchema().isAutoCreate()) {
                SchemaScripts.apply(driver.dataSource(dbShardId), catalog.dialect());
            }
            return null;
        } catch (RuntimeException e) {
            log.error("[DS-STARTUP] Failed to initialize db shard {}: {}", dbShardId, e.getMessage());
            return e.getMessage();
        }
    }
}
