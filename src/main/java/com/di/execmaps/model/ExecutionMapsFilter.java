package com.di.execmaps.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Identifies one workflow execution: {@code (shardId, domainId, workflowId, runId)}.
 */
@Value
@Builder
public class ExecutionMapsFilter {

    int shardId;
    @NonNull UUID domainId;
    @NonNull String workflowId;
    @NonNull UUID runId;

    public static ExecutionMapsFilter of(int shardId, UUID domainId, String workflowId, UUID runId) {
        return new ExecutionMapsFilter(shardId, domainId, workflowId, runId);
    }

    /** Filter for the execution that owns the given row. */
    public static ExecutionMapsFilter forRow(ExecutionMapRow row) {
        return new ExecutionMapsFilter(row.getShardId(), row.getDomainId(), row.getWorkflowId(), row.getRunId());
    }
}
