package com.urbanflux.complaints.service;

import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.RunStatus;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Outcome of a finished run. runId is null for dry runs, which are never tracked.
 */
@Value
@Builder
public class EtlRunResult {
    UUID runId;
    EtlMode mode;
    RunStatus status;
    boolean dryRun;
    EtlStats stats;
    int chunks;
    OffsetDateTime lastCreatedAt;
    Long lastUniqueKey;
}
