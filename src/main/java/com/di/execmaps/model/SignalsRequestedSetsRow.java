package com.di.execmaps.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Row of the {@code signals_requested_sets} table. Presence of the row is the whole payload.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalsRequestedSetsRow implements ExecutionMapRow {

    private int    shardId;
    private UUID   domainId;
    private String workflowId;
    private UUID   runId;
    private String signalId;
}
