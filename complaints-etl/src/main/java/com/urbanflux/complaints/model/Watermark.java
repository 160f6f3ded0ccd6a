package com.urbanflux.complaints.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Resume point taken from the most recently completed run.
 * lastCreatedAt/lastUniqueKey are null when that run never saw a record.
 */
@Value
public class Watermark {

    UUID runId;
    OffsetDateTime lastCreatedAt;
    Long lastUniqueKey;
    EtlMode runMode;

    @JsonIgnore
    public boolean isBounded() {
        return lastCreatedAt != null && lastUniqueKey != null;
    }

    /** True when the record sorts strictly after this point on (createdAt, uniqueKey). */
    public boolean admits(ServiceRequest record) {
        if (!isBounded()) return true;
        int cmp = record.getCreatedAt().compareTo(lastCreatedAt);
        return cmp > 0 || (cmp == 0 && record.getUniqueKey() > lastUniqueKey);
    }
}
