package com.di.execmaps.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row of the {@code activity_info_maps} table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityInfoMapsRow implements ExecutionMapRow {

    private int     shardId;
    private UUID    domainId;
    private String  workflowId;
    private UUID    runId;

    /** Map key: schedule id of the activity. */
    private long scheduleId;

    // ---- payload -----------------------------------------------------------
    private byte[]  data;
    private String  dataEncoding;
    /** Details of the most recent heartbeat; may be null. */
    private byte[]  lastHeartbeatDetails;
    /** Time of the most recent heartbeat; null when the activity never heartbeated. */
    private Instant lastHeartbeatUpdatedTime;
}
