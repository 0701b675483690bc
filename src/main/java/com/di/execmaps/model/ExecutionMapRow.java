package com.di.execmaps.model;

import java.util.UUID;

/**
 * Identity columns carried by every map row: the owning execution.
 */
public interface ExecutionMapRow {

    int getShardId();

    void setShardId(int shardId);

    UUID getDomainId();

    void setDomainId(UUID domainId);

    String getWorkflowId();

    void setWorkflowId(String workflowId);

    UUID getRunId();

    void setRunId(UUID runId);

    /** Overwrites the identity columns with the filter's values. */
    default void reattachIdentity(ExecutionMapsFilter filter) {
        setShardId(filter.getShardId());
        setDomainId(filter.getDomainId());
        setWorkflowId(filter.getWorkflowId());
        setRunId(filter.getRunId());
    }
}
