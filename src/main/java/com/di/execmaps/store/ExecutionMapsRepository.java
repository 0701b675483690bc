package com.di.execmaps.store;

import com.di.execmaps.aspect.LogMapOperation;
import com.di.execmaps.codec.ActivityInfoMapsRowCodec;
import com.di.execmaps.codec.ChildExecutionInfoMapsRowCodec;
import com.di.execmaps.codec.RequestCancelInfoMapsRowCodec;
import com.di.execmaps.codec.SignalInfoMapsRowCodec;
import com.di.execmaps.codec.SignalsRequestedSetsRowCodec;
import com.di.execmaps.codec.TimerInfoMapsRowCodec;
import com.di.execmaps.driver.OperationContext;
import com.di.execmaps.driver.ShardedSqlDriver;
import com.di.execmaps.model.ActivityInfoMapsRow;
import com.di.execmaps.model.ChildExecutionInfoMapsRow;
import com.di.execmaps.model.ExecutionMapsFilter;
import com.di.execmaps.model.RequestCancelInfoMapsRow;
import com.di.execmaps.model.SignalInfoMapsRow;
import com.di.execmaps.model.SignalsRequestedSetsRow;
import com.di.execmaps.model.TimerInfoMapsRow;
import com.di.execmaps.model.WriteResult;
import com.di.execmaps.query.MapQueryTemplateCatalog;
import com.di.execmaps.schema.MapKind;
import com.di.execmaps.sharding.ShardRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Replace, select and delete for the six per-execution maps.
 *
 * <p>Every call touches exactly one physical shard: the one the execution's logical shard
 * resolves to. Replace is atomic per call; select returns rows in no particular order with
 * their identity fields set from the filter.
 *
 * <p>Delete semantics for every kind: {@code keys == null} removes all rows of the execution,
 * an empty key collection is a no-op, otherwise only the listed keys are removed.
 */
@Slf4j
@Repository
public class ExecutionMapsRepository {

    private final ExecutionMapStore<ActivityInfoMapsRow, Long> activityInfo;
    private final ExecutionMapStore<TimerInfoMapsRow, String> timerInfo;
    private final ExecutionMapStore<ChildExecutionInfoMapsRow, Long> childExecutionInfo;
    private final ExecutionMapStore<RequestCancelInfoMapsRow, Long> requestCancelInfo;
    private final ExecutionMapStore<SignalInfoMapsRow, Long> signalInfo;
    private final ExecutionMapStore<SignalsRequestedSetsRow, String> signalsRequested;

    public ExecutionMapsRepository(MapQueryTemplateCatalog catalog, ShardRouter router, ShardedSqlDriver driver) {
        if (router.getTotalPhysicalShards() != driver.physicalShardCount()) {
            throw new IllegalStateException(String.format(
                    "Shard router expects %d physical shard(s) but %d DataSource(s) are configured",
                    router.getTotalPhysicalShards(), driver.physicalShardCount()));
        }
        this.activityInfo = new ExecutionMapStore<>(MapKind.ACTIVITY_INFO, catalog.get(MapKind.ACTIVITY_INFO),
                new ActivityInfoMapsRowCodec(), catalog.dialect(), router, driver);
        this.timerInfo = new ExecutionMapStore<>(MapKind.TIMER_INFO, catalog.get(MapKind.TIMER_INFO),
                new TimerInfoMapsRowCodec(), catalog.dialect(), router, driver);
        this.childExecutionInfo = new ExecutionMapStore<>(MapKind.CHILD_EXECUTION_INFO, catalog.get(MapKind.CHILD_EXECUTION_INFO),
                new ChildExecutionInfoMapsRowCodec(), catalog.dialect(), router, driver);
        this.requestCancelInfo = new ExecutionMapStore<>(MapKind.REQUEST_CANCEL_INFO, catalog.get(MapKind.REQUEST_CANCEL_INFO),
                new RequestCancelInfoMapsRowCodec(), catalog.dialect(), router, driver);
        this.signalInfo = new ExecutionMapStore<>(MapKind.SIGNAL_INFO, catalog.get(MapKind.SIGNAL_INFO),
                new SignalInfoMapsRowCodec(), catalog.dialect(), router, driver);
        this.signalsRequested = new ExecutionMapStore<>(MapKind.SIGNALS_REQUESTED, catalog.get(MapKind.SIGNALS_REQUESTED),
                new SignalsRequestedSetsRowCodec(), catalog.dialect(), router, driver);
        log.info("[MAPS] Repository ready: {} map kind(s), {} physical shard(s), dialect '{}'",
                MapKind.values().length, driver.physicalShardCount(), catalog.dialect().type());
    }

    // --- activity-info ---

    @LogMapOperation(kind = "activity-info", operation = "replace")
    public WriteResult replaceIntoActivityInfoMaps(OperationContext ctx, List<ActivityInfoMapsRow> rows) {
        return activityInfo.replace(ctx, rows);
    }

    @LogMapOperation(kind = "activity-info", operation = "select")
    public List<ActivityInfoMapsRow> selectFromActivityInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return activityInfo.select(ctx, filter);
    }

    /**
     * @param keys schedule ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "activity-info", operation = "delete")
    public WriteResult deleteFromActivityInfoMaps(OperationContext ctx, ExecutionMapsFilter filter, Collection<Long> keys) {
        return activityInfo.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "activity-info", operation = "delete")
    public WriteResult deleteFromActivityInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return activityInfo.deleteAll(ctx, filter);
    }

    // --- timer-info ---

    @LogMapOperation(kind = "timer-info", operation = "replace")
    public WriteResult replaceIntoTimerInfoMaps(OperationContext ctx, List<TimerInfoMapsRow> rows) {
        return timerInfo.replace(ctx, rows);
    }

    @LogMapOperation(kind = "timer-info", operation = "select")
    public List<TimerInfoMapsRow> selectFromTimerInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return timerInfo.select(ctx, filter);
    }

    /**
     * @param keys timer ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "timer-info", operation = "delete")
    public WriteResult deleteFromTimerInfoMaps(OperationContext ctx, ExecutionMapsFilter filter, Collection<String> keys) {
        return timerInfo.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "timer-info", operation = "delete")
    public WriteResult deleteFromTimerInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return timerInfo.deleteAll(ctx, filter);
    }

    // --- child-execution-info ---

    @LogMapOperation(kind = "child-execution-info", operation = "replace")
    public WriteResult replaceIntoChildExecutionInfoMaps(OperationContext ctx, List<ChildExecutionInfoMapsRow> rows) {
        return childExecutionInfo.replace(ctx, rows);
    }

    @LogMapOperation(kind = "child-execution-info", operation = "select")
    public List<ChildExecutionInfoMapsRow> selectFromChildExecutionInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return childExecutionInfo.select(ctx, filter);
    }

    /**
     * @param keys initiated event ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "child-execution-info", operation = "delete")
    public WriteResult deleteFromChildExecutionInfoMaps(OperationContext ctx, ExecutionMapsFilter filter, Collection<Long> keys) {
        return childExecutionInfo.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "child-execution-info", operation = "delete")
    public WriteResult deleteFromChildExecutionInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return childExecutionInfo.deleteAll(ctx, filter);
    }

    // --- request-cancel-info ---

    @LogMapOperation(kind = "request-cancel-info", operation = "replace")
    public WriteResult replaceIntoRequestCancelInfoMaps(OperationContext ctx, List<RequestCancelInfoMapsRow> rows) {
        return requestCancelInfo.replace(ctx, rows);
    }

    @LogMapOperation(kind = "request-cancel-info", operation = "select")
    public List<RequestCancelInfoMapsRow> selectFromRequestCancelInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return requestCancelInfo.select(ctx, filter);
    }

    /**
     * @param keys initiated event ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "request-cancel-info", operation = "delete")
    public WriteResult deleteFromRequestCancelInfoMaps(OperationContext ctx, ExecutionMapsFilter filter, Collection<Long> keys) {
        return requestCancelInfo.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "request-cancel-info", operation = "delete")
    public WriteResult deleteFromRequestCancelInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return requestCancelInfo.deleteAll(ctx, filter);
    }

    // --- signal-info ---

    @LogMapOperation(kind = "signal-info", operation = "replace")
    public WriteResult replaceIntoSignalInfoMaps(OperationContext ctx, List<SignalInfoMapsRow> rows) {
        return signalInfo.replace(ctx, rows);
    }

    @LogMapOperation(kind = "signal-info", operation = "select")
    public List<SignalInfoMapsRow> selectFromSignalInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return signalInfo.select(ctx, filter);
    }

    /**
     * @param keys initiated event ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "signal-info", operation = "delete")
    public WriteResult deleteFromSignalInfoMaps(OperationContext ctx, ExecutionMapsFilter filter, Collection<Long> keys) {
        return signalInfo.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "signal-info", operation = "delete")
    public WriteResult deleteFromSignalInfoMaps(OperationContext ctx, ExecutionMapsFilter filter) {
        return signalInfo.deleteAll(ctx, filter);
    }

    // --- signals-requested ---

    @LogMapOperation(kind = "signals-requested", operation = "replace")
    public WriteResult replaceIntoSignalsRequestedSets(OperationContext ctx, List<SignalsRequestedSetsRow> rows) {
        return signalsRequested.replace(ctx, rows);
    }

    @LogMapOperation(kind = "signals-requested", operation = "select")
    public List<SignalsRequestedSetsRow> selectFromSignalsRequestedSets(OperationContext ctx, ExecutionMapsFilter filter) {
        return signalsRequested.select(ctx, filter);
    }

    /**
     * @param keys signal ids to remove; {@code null} removes every row of the execution
     */
    @LogMapOperation(kind = "signals-requested", operation = "delete")
    public WriteResult deleteFromSignalsRequestedSets(OperationContext ctx, ExecutionMapsFilter filter, Collection<String> keys) {
        return signalsRequested.delete(ctx, filter, keys);
    }

    @LogMapOperation(kind = "signals-requested", operation = "delete")
    public WriteResult deleteFromSignalsRequestedSets(OperationContext ctx, ExecutionMapsFilter filter) {
        return signalsRequested.deleteAll(ctx, filter);
    }

    /**
     * Removes every map row of the execution, kind by kind. Each kind is its own unit of work;
     * the first failure is propagated and later kinds are not attempted.
     */
    @LogMapOperation(kind = "all", operation = "delete-all")
    public WriteResult deleteAllMapsForExecution(OperationContext ctx, ExecutionMapsFilter filter) {
        return activityInfo.deleteAll(ctx, filter)
                .plus(timerInfo.deleteAll(ctx, filter))
                .plus(childExecutionInfo.deleteAll(ctx, filter))
                .plus(requestCancelInfo.deleteAll(ctx, filter))
                .plus(signalInfo.deleteAll(ctx, filter))
                .plus(signalsRequested.deleteAll(ctx, filter));
    }
}
