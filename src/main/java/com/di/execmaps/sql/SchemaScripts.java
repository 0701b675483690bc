package com.di.execmaps.sql;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Applies the map-table DDL of a dialect to one physical shard.
 */
@Slf4j
public final class SchemaScripts {

    private SchemaScripts() {
    }

    public static void apply(DataSource dataSource, SqlDialect dialect) {
        ClassPathResource script = new ClassPathResource(dialect.schemaScript());
        if (!script.exists()) {
            throw new IllegalStateException("Schema script not found on classpath: " + dialect.schemaScript());
        }
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
        populator.setContinueOnError(false);
        populator.execute(dataSource);
        log.info("[SCHEMA] Applied {}", dialect.schemaScript());
    }
}
