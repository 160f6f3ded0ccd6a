package com.urbanflux.complaints.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row counters for a chunk or a whole run. Per-chunk instances roll up into run totals via {@link #merge}.
 *
 * Per chunk: rowsRead == rowsParsed + parseErrors.
 * Per Transform input: rowsValidated + rowsDuplicated + rowsRejected == records in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlStats {

    private long rowsRead;
    private long rowsParsed;
    private long rowsValidated;
    private long rowsInserted;
    private long rowsDuplicated;
    private long rowsRejected;
    /** below the incremental watermark, never handed to Transform */
    private long rowsSkipped;
    private long parseErrors;
    private long validationErrors;

    public static EtlStats empty() {
        return new EtlStats();
    }

    /** Element-wise sum into this instance; returns {@code this}. */
    public EtlStats merge(EtlStats other) {
        rowsRead += other.rowsRead;
        rowsParsed += other.rowsParsed;
        rowsValidated += other.rowsValidated;
        rowsInserted += other.rowsInserted;
        rowsDuplicated += other.rowsDuplicated;
        rowsRejected += other.rowsRejected;
        rowsSkipped += other.rowsSkipped;
        parseErrors += other.parseErrors;
        validationErrors += other.validationErrors;
        return this;
    }

    public EtlStats copy() {
        return new EtlStats().merge(this);
    }
}
