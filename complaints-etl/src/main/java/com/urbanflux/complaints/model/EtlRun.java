package com.urbanflux.complaints.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One attempt of the pipeline, as stored in the etl_watermarks table.
 * Written as RUNNING at start and updated exactly once to COMPLETED or FAILED.
 */
@Data
@Builder
public class EtlRun {

    private UUID runId;
    private EtlMode runMode;
    private RunStatus status;
    private OffsetDateTime startedAt;
    private OffsetDateTime completedAt;
    private OffsetDateTime lastCreatedAt;
    private Long lastUniqueKey;
    private EtlStats stats;
    private String errorMessage;    // null unless FAILED
}
