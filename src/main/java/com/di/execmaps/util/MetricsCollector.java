package com.di.execmaps.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for map operations, tagged by map kind and operation.
 */
@Slf4j
@Component
public class MetricsCollector {

    public static final String OPERATION_DURATION = "execmaps.operation.duration";
    public static final String OPERATION_ROWS = "execmaps.operation.rows";
    public static final String OPERATION_ERRORS = "execmaps.operation.errors";

    private final MeterRegistry meterRegistry;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Records a successful map operation.
     *
     * @param kind          map kind tag
     * @param operation     operation name
     * @param durationNanos elapsed time
     * @param rows          rows returned or affected
     */
    public void recordMapOperation(String kind, String operation, long durationNanos, long rows) {
        operationTimer(kind, operation, "success").record(durationNanos, TimeUnit.NANOSECONDS);
        DistributionSummary.builder(OPERATION_ROWS)
                .description("Rows returned or affected per map operation")
                .baseUnit("rows")
                .tag("kind", kind)
                .tag("operation", operation)
                .register(meterRegistry)
                .record(rows);
    }

    /**
     * Records a failed map operation.
     *
     * @param category error category name used as tag
     */
    public void recordMapOperationFailure(String kind, String operation, String category, long durationNanos) {
        operationTimer(kind, operation, "error").record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(OPERATION_ERRORS)
                .description("Failed map operations by error category")
                .tag("kind", kind)
                .tag("operation", operation)
                .tag("category", category)
                .register(meterRegistry)
                .increment();
        log.debug("Recorded map operation failure: kind={}, operation={}, category={}", kind, operation, category);
    }

    private Timer operationTimer(String kind, String operation, String status) {
        return Timer.builder(OPERATION_DURATION)
                .description("Time taken by a map operation")
                .tag("kind", kind)
                .tag("operation", operation)
                .tag("status", status)
                .register(meterRegistry);
    }
}
