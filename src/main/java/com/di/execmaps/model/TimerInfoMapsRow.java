package com.di.execmaps.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Row of the {@code timer_info_maps} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimerInfoMapsRow implements ExecutionMapRow {

    private int     shardId;
    private UUID    domainId;
    private String  workflowId;
    private UUID    runId;

    /** Map key: user timer id. */
    private String timerId;

    // ---- payload -----------------------------------------------------------
    private byte[]  data;
    private String  dataEncoding;
}
