package com.di.execmaps.config;

import com.di.execmaps.driver.ShardDataSources;
import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.query.MapQueryTemplateCatalog;
import com.di.execmaps.schema.MapSchemaRegistry;
import com.di.execmaps.sharding.ShardRouter;
import com.di.execmaps.sql.SqlDialectRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root of the map store: the registry, templates, router and shard pools are
 * built once here and injected; nothing is registered statically.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PersistenceProperties.class)
public class PersistenceConfiguration {

    @Bean
    public MapSchemaRegistry mapSchemaRegistry() {
        return MapSchemaRegistry.standard();
    }

    @Bean
    public MapQueryTemplateCatalog mapQueryTemplateCatalog(MapSchemaRegistry registry,
                                                           SqlDialectRegistry dialects,
                                                           PersistenceProperties properties) {
        return MapQueryTemplateCatalog.build(registry, dialects.getDialect(properties.getDialect()));
    }

    @Bean
    public ShardRouter shardRouter(PersistenceProperties properties) {
        int numDbShards = properties.resolveNumDbShards();
        log.info("[MAPS] Routing logical shards over {} physical shard(s)", numDbShards);
        return new ShardRouter(numDbShards);
    }

    @Bean(destroyMethod = "close")
    public ShardDataSources shardDataSources() {
        return new ShardDataSources();
    }

    @Bean
    public ShardedSqlDriver shardedSqlDriver(ShardDataSources shardDataSources, PersistenceProperties properties) {
        properties.resolveNumDbShards();
        return new ShardedSqlDriver(shardDataSources.initAll(properties.toDbConfigSnapshots()),
                properties.getDefaultOperationTimeout());
    }
}
