package com.di.execmaps.aspect;

import com.di.execmaps.model.ExecutionMapRow;
import com.di.execmaps.model.ExecutionMapsFilter;
import com.di.execmaps.model.WriteResult;
import com.di.execmaps.util.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Logs and measures methods annotated with {@link LogMapOperation}.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class MapOperationAspect {

    static final String MDC_SHARD_ID = "shardId";
    static final String MDC_MAP_KIND = "mapKind";

    private final MetricsCollector metricsCollector;

    @Around("@annotation(com.di.execmaps.aspect.LogMapOperation)")
    public Object logMapOperation(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        LogMapOperation annotation = signature.getMethod().getAnnotation(LogMapOperation.class);
        String kind = annotation.kind();
        String operation = annotation.operation();

        Integer shardId = resolveShardId(joinPoint.getArgs());
        String previousShardId = MDC.get(MDC_SHARD_ID);
        String previousKind = MDC.get(MDC_MAP_KIND);
        if (shardId != null) {
            MDC.put(MDC_SHARD_ID, String.valueOf(shardId));
        }
        MDC.put(MDC_MAP_KIND, kind);
        long start = System.nanoTime();
        try {
            Object result = joinPoint.proceed();
            long durationNanos = System.nanoTime() - start;
            long rows = rowCount(result);
            metricsCollector.recordMapOperation(kind, operation, durationNanos, rows);
            log.debug("[MAPS] {} {} completed | shardId={} | rows={} | durationMs={}",
                    kind, operation, shardId, rows, durationNanos / 1_000_000);
            return result;
        } catch (Throwable e) {
            long durationNanos = System.nanoTime() - start;
            ErrorCategory category = ErrorCategory.categorize(e);
            metricsCollector.recordMapOperationFailure(kind, operation, category.name(), durationNanos);
            log.warn("[MAPS] {} {} failed | shardId={} | category={} | errorType={} | error={}",
                    kind, operation, shardId, category, e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } finally {
            restore(MDC_SHARD_ID, previousShardId);
            restore(MDC_MAP_KIND, previousKind);
        }
    }

    /** Logical shard id of the filter argument, or of the first row of a row-list argument. */
    static Integer resolveShardId(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof ExecutionMapsFilter filter) {
                return filter.getShardId();
            }
            if (arg instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof ExecutionMapRow row) {
                return row.getShardId();
            }
        }
        return null;
    }

    static long rowCount(Object result) {
        if (result instanceof WriteResult writeResult) {
            return writeResult.rowsAffected();
        }
        if (result instanceof Collection<?> collection) {
            return collection.size();
        }
        return 0;
    }

    private static void restore(String key, String previous) {
        if (previous != null) {
            MDC.put(key, previous);
        } else {
            MDC.remove(key);
        }
    }
}
