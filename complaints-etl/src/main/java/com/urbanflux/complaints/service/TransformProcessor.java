package com.urbanflux.complaints.service;

import com.urbanflux.complaints.model.Borough;
import com.urbanflux.complaints.model.Chunk;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.ServiceRequest;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Deduplicates and validates chunks for a single run.
 *
 * One instance per run, fed chunks in source order. The key set lives as long as the
 * instance; {@link #reset()} clears it. Each record is checked for duplication first,
 * then validated, and lands in exactly one of rowsDuplicated, rowsRejected or rowsValidated.
 */
@Slf4j
public class TransformProcessor {

    private final ServiceRequestValidator validator;
    private final RejectedRowSink rejects;
    private final Deduplicator deduplicator = new Deduplicator();

    public TransformProcessor(ServiceRequestValidator validator) {
        this(validator, RejectedRowSink.NONE);
    }

    public TransformProcessor(ServiceRequestValidator validator, RejectedRowSink rejects) {
        this.validator = validator;
        this.rejects = rejects;
    }

    /**
     * @return the surviving records, with this chunk's contributions merged into a copy of its stats
     */
    public Chunk process(Chunk chunk) {
        EtlStats stats = chunk.getStats().copy();
        List<ServiceRequest> clean = new ArrayList<>(chunk.size());

        for (ServiceRequest record : chunk.getRecords()) {
            if (deduplicator.isDuplicate(record.getUniqueKey())) {
                stats.setRowsDuplicated(stats.getRowsDuplicated() + 1);
                continue;
            }

            List<String> errors = validator.validate(record);
            if (errors.isEmpty()) {
                stats.setRowsValidated(stats.getRowsValidated() + 1);
                clean.add(record);
            } else {
                stats.setRowsRejected(stats.getRowsRejected() + 1);
                stats.setValidationErrors(stats.getValidationErrors() + 1);
                log.debug("unique_key {} failed validation: {}", record.getUniqueKey(), errors);
                rejects.reject(RejectedRowSink.Stage.VALIDATION, 0, toFields(record), String.join("; ", errors));
            }
        }

        log.info("Transform complete: {} in, {} validated, {} duplicates, {} rejected",
                chunk.size(), clean.size(),
                stats.getRowsDuplicated() - chunk.getStats().getRowsDuplicated(),
                stats.getRowsRejected() - chunk.getStats().getRowsRejected());

        return new Chunk(clean, stats);
    }

    public int uniqueKeysSeen() {
        return deduplicator.uniqueCount();
    }

    /** Forget every key seen so far. */
    public void reset() {
        deduplicator.clear();
    }

    private static String[] toFields(ServiceRequest r) {
        return new String[]{
                String.valueOf(r.getUniqueKey()),
                str(r.getCreatedAt()),
                str(r.getClosedAt()),
                str(r.getComplaintType()),
                str(r.getDescriptor()),
                r.borough().map(Borough::label).orElse(""),
                str(r.getLatitude()),
                str(r.getLongitude())
        };
    }

    private static String str(Object val) {
        return val == null ? "" : val.toString();
    }
}
