package com.di.execmaps.query;

import com.di.execmaps.schema.MapKind;
import com.di.execmaps.schema.MapSchema;
import com.di.execmaps.schema.MapSchemaRegistry;
import com.di.execmaps.sql.H2Dialect;
import com.di.execmaps.sql.MySqlDialect;
import com.di.execmaps.sql.PostgresDialect;
import com.di.execmaps.sql.SqlDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MapQueryTemplateGenerator Tests")
class MapQueryTemplateGeneratorTest {

    private static final MapSchemaRegistry REGISTRY = MapSchemaRegistry.standard();
    private static final String IDENTITY =
            "shard_id = :shard_id AND domain_id = :domain_id AND workflow_id = :workflow_id AND run_id = :run_id";

    // ============================================================================
    // Upsert per dialect
    // ============================================================================

    @Test
    @DisplayName("Should generate PostgreSQL ON CONFLICT upsert overwriting every value column")
    void testPostgresUpsert() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.TIMER_INFO), new PostgresDialect());
        assertEquals("INSERT INTO timer_info_maps (shard_id, domain_id, workflow_id, run_id, timer_id, data, data_encoding)"
                        + " VALUES (:shard_id, :domain_id, :workflow_id, :run_id, :timer_id, :data, :data_encoding)"
                        + " ON CONFLICT (shard_id, domain_id, workflow_id, run_id, timer_id)"
                        + " DO UPDATE SET data = excluded.data, data_encoding = excluded.data_encoding",
                t.upsert().sql());
    }

    @Test
    @DisplayName("Should generate PostgreSQL DO NOTHING for key-only table")
    void testPostgresUpsertKeyOnly() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.SIGNALS_REQUESTED), new PostgresDialect());
        assertEquals("INSERT INTO signals_requested_sets (shard_id, domain_id, workflow_id, run_id, signal_id)"
                        + " VALUES (:shard_id, :domain_id, :workflow_id, :run_id, :signal_id)"
                        + " ON CONFLICT (shard_id, domain_id, workflow_id, run_id, signal_id) DO NOTHING",
                t.upsert().sql());
    }

    @Test
    @DisplayName("Should generate MySQL ON DUPLICATE KEY UPDATE upsert")
    void testMySqlUpsert() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.ACTIVITY_INFO), new MySqlDialect());
        String sql = t.upsert().sql();
        assertTrue(sql.startsWith("INSERT INTO activity_info_maps ("), sql);
        assertTrue(sql.endsWith(" ON DUPLICATE KEY UPDATE data = VALUES(data), data_encoding = VALUES(data_encoding),"
                + " last_heartbeat_details = VALUES(last_heartbeat_details),"
                + " last_heartbeat_updated_time = VALUES(last_heartbeat_updated_time)"), sql);
    }

    @Test
    @DisplayName("Should absorb only key conflicts for a MySQL key-only table")
    void testMySqlUpsertKeyOnly() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.SIGNALS_REQUESTED), new MySqlDialect());
        assertEquals("INSERT INTO signals_requested_sets (shard_id, domain_id, workflow_id, run_id, signal_id)"
                        + " VALUES (:shard_id, :domain_id, :workflow_id, :run_id, :signal_id)"
                        + " ON DUPLICATE KEY UPDATE signal_id = signal_id",
                t.upsert().sql());
        assertFalse(t.upsert().sql().contains("IGNORE"));
    }

    @Test
    @DisplayName("Should generate H2 MERGE keyed on the primary key")
    void testH2Upsert() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.SIGNAL_INFO), new H2Dialect());
        assertEquals("MERGE INTO signal_info_maps (shard_id, domain_id, workflow_id, run_id, initiated_id, data, data_encoding)"
                        + " KEY (shard_id, domain_id, workflow_id, run_id, initiated_id)"
                        + " VALUES (:shard_id, :domain_id, :workflow_id, :run_id, :initiated_id, :data, :data_encoding)",
                t.upsert().sql());
    }

    // ============================================================================
    // Select / delete shapes (dialect independent)
    // ============================================================================

    @Test
    @DisplayName("Should select key then value columns for one execution")
    void testSelectAll() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.CHILD_EXECUTION_INFO), new PostgresDialect());
        assertEquals("SELECT initiated_id, data, data_encoding FROM child_execution_info_maps WHERE " + IDENTITY,
                t.selectAll().sql());
        assertEquals("SELECT initiated_id, data, data_encoding FROM child_execution_info_maps"
                        + " WHERE shard_id = ? AND domain_id = ? AND workflow_id = ? AND run_id = ?",
                t.selectAll().jdbcSql());
    }

    @Test
    @DisplayName("Should delete by key set with a single collection parameter")
    void testDeleteByKeys() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.REQUEST_CANCEL_INFO), new MySqlDialect());
        assertEquals("DELETE FROM request_cancel_info_maps WHERE " + IDENTITY + " AND initiated_id IN (:keys)",
                t.deleteByKeys().sql());
    }

    @Test
    @DisplayName("Should delete every row of one execution")
    void testDeleteAll() {
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(REGISTRY.get(MapKind.SIGNALS_REQUESTED), new H2Dialect());
        assertEquals("DELETE FROM signals_requested_sets WHERE " + IDENTITY, t.deleteAll().sql());
    }

    static Stream<Arguments> everyKindAndDialect() {
        SqlDialect[] dialects = {new PostgresDialect(), new MySqlDialect(), new H2Dialect()};
        return Stream.of(MapKind.values())
                .flatMap(kind -> Stream.of(dialects).map(d -> Arguments.of(kind, d)));
    }

    @ParameterizedTest(name = "{0} / {1}")
    @MethodSource("everyKindAndDialect")
    @DisplayName("Should bind one placeholder per upsert column and never inline values")
    void testUpsertPlaceholders(MapKind kind, SqlDialect dialect) {
        MapSchema schema = REGISTRY.get(kind);
        MapQueryTemplates t = MapQueryTemplateGenerator.generate(schema, dialect);
        long placeholders = t.upsert().jdbcSql().chars().filter(c -> c == '?').count();
        assertEquals(schema.allColumns().size(), placeholders);
        assertSame(schema, t.schema());
    }

    @Test
    @DisplayName("Should build a catalog covering every kind")
    void testCatalog() {
        MapQueryTemplateCatalog catalog = MapQueryTemplateCatalog.build(REGISTRY, new H2Dialect());
        assertEquals("h2", catalog.dialect().type());
        for (MapKind kind : MapKind.values()) {
            assertEquals(REGISTRY.get(kind), catalog.get(kind).schema());
        }
    }
}
