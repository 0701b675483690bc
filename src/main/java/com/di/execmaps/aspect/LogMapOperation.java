package com.di.execmaps.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a map operation for {@link MapOperationAspect}: duration and row metrics, a DEBUG line
 * on success and a WARN line with the {@link ErrorCategory} on failure. The execution's
 * logical shard id is put in the MDC ({@code shardId}) while the operation runs.
 *
 * <pre>
 * {@code
 * @LogMapOperation(kind = "timer-info", operation = "replace")
 * public WriteResult replaceIntoTimerInfoMaps(OperationContext ctx, List<TimerInfoMapsRow> rows) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogMapOperation {

    /** Map kind tag, e.g. "activity-info". Used as the {@code kind} metric tag. */
    String kind();

    /** "replace", "select", "delete" or "delete-all". */
    String operation();
}
