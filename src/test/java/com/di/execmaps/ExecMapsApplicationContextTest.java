package com.di.execmaps;

import com.di.execmaps.driver.OperationContext;
import com.di.execmaps.health.ShardConnectivityHealthIndicator;
import com.di.execmaps.model.ExecutionMapsFilter;
import com.di.execmaps.model.TimerInfoMapsRow;
import com.di.execmaps.sharding.ShardRouter;
import com.di.execmaps.store.ExecutionMapsRepository;
import com.di.execmaps.util.MetricsCollector;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application against two in-memory H2 shards with schema auto-creation on.
 */
@SpringBootTest(properties = {
        "execmaps.persistence.dialect=h2",
        "execmaps.persistence.num-db-shards=2",
        "execmaps.persistence.schema.auto-create=true",
        "execmaps.persistence.shards[0].jdbc-url=jdbc:h2:mem:execmaps_ctx_0;DB_CLOSE_DELAY=-1",
        "execmaps.persistence.shards[0].username=sa",
        "execmaps.persistence.shards[0].driver-class-name=org.h2.Driver",
        "execmaps.persistence.shards[1].jdbc-url=jdbc:h2:mem:execmaps_ctx_1;DB_CLOSE_DELAY=-1",
        "execmaps.persistence.shards[1].username=sa",
        "execmaps.persistence.shards[1].driver-class-name=org.h2.Driver"
})
@DisplayName("ExecMapsApplication context Tests")
class ExecMapsApplicationContextTest {

    @TestConfiguration
    static class Metrics {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private ExecutionMapsRepository repository;

    @Autowired
    private ShardRouter router;

    @Autowired
    private ShardConnectivityHealthIndicator health;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Should route over every configured shard")
    void testRouterMatchesConfiguration() {
        assertEquals(2, router.getTotalPhysicalShards());
    }

    @Test
    @DisplayName("Should report every shard healthy once the schema is applied")
    void testHealthUp() {
        assertEquals(Status.UP, health.health().getStatus());
    }

    @Test
    @DisplayName("Should store maps through the advised repository and record metrics")
    void testRepositoryThroughAspect() {
        ExecutionMapsFilter e = ExecutionMapsFilter.of(9, UUID.randomUUID(), "wf-ctx", UUID.randomUUID());
        TimerInfoMapsRow row = TimerInfoMapsRow.builder()
                .shardId(e.getShardId()).domainId(e.getDomainId()).workflowId(e.getWorkflowId()).runId(e.getRunId())
                .timerId("t1").data("x".getBytes(StandardCharsets.UTF_8)).dataEncoding("json")
                .build();
        OperationContext ctx = OperationContext.background();

        assertEquals(1, repository.replaceIntoTimerInfoMaps(ctx, List.of(row)).rowsAffected());
        assertEquals(List.of(row), repository.selectFromTimerInfoMaps(ctx, e));
        assertEquals(1, repository.deleteFromTimerInfoMaps(ctx, e).rowsAffected());

        assertNotNull(meterRegistry.find(MetricsCollector.OPERATION_DURATION)
                .tag("kind", "timer-info").tag("operation", "replace").tag("status", "success")
                .timer());
        assertNotNull(meterRegistry.find(MetricsCollector.OPERATION_DURATION)
                .tag("kind", "timer-info").tag("operation", "select")
                .timer());
    }
}
