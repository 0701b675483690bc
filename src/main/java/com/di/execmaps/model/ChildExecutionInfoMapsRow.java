package com.di.execmaps.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Row of the {@code child_execution_info_maps} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChildExecutionInfoMapsRow implements ExecutionMapRow {

    private int     shardId;
    private UUID    domainId;
    private String  workflowId;
    private UUID    runId;

    /** Map key: event id that initiated the child execution. */
    private long initiatedId;

    // ---- payload -----------------------------------------------------------
    private byte[]  data;
    private String  dataEncoding;
}
