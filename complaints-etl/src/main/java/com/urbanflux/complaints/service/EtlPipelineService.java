package com.urbanflux.complaints.service;

import com.urbanflux.complaints.exception.EtlException;
import com.urbanflux.complaints.model.Chunk;
import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.model.EtlRun;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.RunStatus;
import com.urbanflux.complaints.model.ServiceRequest;
import com.urbanflux.complaints.model.Watermark;
import com.urbanflux.complaints.output.BadRowWriter;
import com.urbanflux.complaints.output.RunSummaryWriter;
import com.urbanflux.complaints.output.RunTracker;
import com.urbanflux.complaints.output.ServiceRequestLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one extract → transform → load run, strictly chunk by chunk in source order.
 *
 * The run is recorded as running before the first read and closed exactly once: completed
 * with its totals and resume point, or failed with the error message. Store errors abort
 * the run; row-level errors are only counted. Dry runs read and transform but never touch
 * the store or the run log.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EtlPipelineService {

    private final CsvSourceReader sourceReader;
    private final ServiceRequestValidator validator;
    private final ServiceRequestLoader loader;
    private final RunTracker runTracker;
    private final BadRowWriter badRowWriter;
    private final RunSummaryWriter summaryWriter;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    /**
     * @throws IllegalStateException if another run is already in progress in this process
     * @throws EtlException          when the run fails; it has already been marked failed
     */
    public EtlRunResult run(EtlRequest request) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("An ETL run is already in progress");
        }
        stopRequested.set(false);
        try {
            return execute(request);
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Stop issuing reads after the chunk in flight; the run is then marked failed. */
    public void requestStop() {
        if (running.get()) {
            log.info("Stop requested, finishing the current chunk");
            stopRequested.set(true);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private EtlRunResult execute(EtlRequest request) {
        EtlMode mode = request.getMode();
        boolean dryRun = request.isDryRun();
        OffsetDateTime startedAt = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        log.info("Running ETL pipeline: mode={}, input={}, chunkSize={}, dryRun={}",
                mode.dbValue(), request.getInput(), request.getChunkSize(), dryRun);

        Watermark watermark = null;
        UUID runId = null;
        if (!dryRun) {
            if (mode == EtlMode.INCREMENTAL) {
                watermark = runTracker.lastWatermark().orElse(null);
                if (watermark == null || !watermark.isBounded()) {
                    log.info("No completed run to resume from, incremental run will read everything");
                } else {
                    log.info("Resuming after created_at={} unique_key={} (run {})",
                            watermark.getLastCreatedAt(), watermark.getLastUniqueKey(), watermark.getRunId());
                }
            }
            runId = runTracker.start(mode);
        }

        String runLabel = runId != null ? runId.toString() : "dry-run-" + startedAt.toEpochSecond();
        ResumePoint resumePoint = new ResumePoint(watermark);
        TransformProcessor processor = null;
        EtlStats total = EtlStats.empty();
        int chunks = 0;
        int uniqueKeys = 0;

        try {
            try (BadRowWriter.BadRowFile badRows = badRowWriter.open(runLabel);
                 CsvChunkReader reader = sourceReader.open(request.getInput(), request.getChunkSize(), badRows)) {

                processor = new TransformProcessor(validator, badRows);

                while (!stopRequested.get() && reader.hasNext()) {
                    Chunk chunk = reader.next();
                    chunks++;

                    Chunk clean = processor.process(applyWatermark(chunk, watermark));

                    long inserted = dryRun || clean.isEmpty() ? 0 : loader.bulkInsert(clean.getRecords());
                    clean.getStats().setRowsInserted(clean.getStats().getRowsInserted() + inserted);

                    total.merge(clean.getStats());
                    resumePoint.observe(clean.getRecords());

                    log.info("Chunk {}: {} read, {} parsed, {} validated, {} inserted",
                            chunks, chunk.getStats().getRowsRead(), chunk.getStats().getRowsParsed(),
                            clean.getStats().getRowsValidated(), inserted);
                }
                if (stopRequested.get()) {
                    throw new EtlException("Run stopped on request after " + chunks + " chunks");
                }
                total.merge(reader.remainder());
                uniqueKeys = processor.uniqueKeysSeen();
            }

            // only once the bad-row file is flushed and the source closed
            if (runId != null) {
                runTracker.complete(runId, total, resumePoint.createdAt, resumePoint.uniqueKey);
            }

        } catch (Exception e) {
            log.error("ETL run {} failed: {}", runLabel, e.getMessage(), e);
            markFailed(runId, e);
            summaryWriter.write(runLabel, toRun(runId, mode, RunStatus.FAILED, startedAt, total,
                    resumePoint, e.getMessage()));
            if (e instanceof EtlException) {
                throw (EtlException) e;
            }
            throw new EtlException("ETL run failed: " + e.getMessage(), e);
        } finally {
            if (processor != null) {
                processor.reset();
            }
        }

        logSummary(runLabel, total, chunks, uniqueKeys, dryRun);
        summaryWriter.write(runLabel, toRun(runId, mode, RunStatus.COMPLETED, startedAt, total, resumePoint, null));

        return EtlRunResult.builder()
                .runId(runId)
                .mode(mode)
                .status(RunStatus.COMPLETED)
                .dryRun(dryRun)
                .stats(total)
                .chunks(chunks)
                .lastCreatedAt(resumePoint.createdAt)
                .lastUniqueKey(resumePoint.uniqueKey)
                .build();
    }

    /**
     * Drops records at or before the watermark. They are counted as skipped and never reach Transform.
     */
    static Chunk applyWatermark(Chunk chunk, Watermark watermark) {
        if (watermark == null || !watermark.isBounded()) return chunk;

        List<ServiceRequest> kept = new ArrayList<>(chunk.size());
        for (ServiceRequest record : chunk.getRecords()) {
            if (watermark.admits(record)) {
                kept.add(record);
            }
        }

        EtlStats stats = chunk.getStats().copy();
        stats.setRowsSkipped(stats.getRowsSkipped() + (chunk.size() - kept.size()));
        return new Chunk(kept, stats);
    }

    private void markFailed(UUID runId, Exception cause) {
        if (runId == null) return;
        try {
            runTracker.fail(runId, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        } catch (RuntimeException e) {
            log.error("Could not mark run {} as failed: {}", runId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private void logSummary(String runLabel, EtlStats total, int chunks, int uniqueKeys, boolean dryRun) {
        log.info("ETL summary for {}: chunks={}, read={}, parsed={}, parseErrors={}, skipped={}, "
                        + "uniqueKeys={}, validated={}, duplicates={}, rejected={}, {}={}",
                runLabel, chunks, total.getRowsRead(), total.getRowsParsed(), total.getParseErrors(),
                total.getRowsSkipped(), uniqueKeys, total.getRowsValidated(), total.getRowsDuplicated(),
                total.getRowsRejected(), dryRun ? "wouldLoad" : "inserted",
                dryRun ? total.getRowsValidated() : total.getRowsInserted());
    }

    private EtlRun toRun(UUID runId, EtlMode mode, RunStatus status, OffsetDateTime startedAt,
                         EtlStats stats, ResumePoint resumePoint, String errorMessage) {
        return EtlRun.builder()
                .runId(runId)
                .runMode(mode)
                .status(status)
                .startedAt(startedAt)
                .completedAt(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC))
                .lastCreatedAt(resumePoint.createdAt)
                .lastUniqueKey(resumePoint.uniqueKey)
                .stats(stats)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * Greatest (createdAt, uniqueKey) seen among loaded records, seeded from the previous
     * watermark so an empty incremental run never moves the resume point backwards.
     */
    private static final class ResumePoint {

        private OffsetDateTime createdAt;
        private Long uniqueKey;

        ResumePoint(Watermark previous) {
            if (previous != null && previous.isBounded()) {
                createdAt = previous.getLastCreatedAt();
                uniqueKey = previous.getLastUniqueKey();
            }
        }

        void observe(List<ServiceRequest> records) {
            for (ServiceRequest r : records) {
                if (createdAt == null) {
                    createdAt = r.getCreatedAt();
                    uniqueKey = r.getUniqueKey();
                    continue;
                }
                int cmp = r.getCreatedAt().compareTo(createdAt);
                if (cmp > 0 || (cmp == 0 && r.getUniqueKey() > uniqueKey)) {
                    createdAt = r.getCreatedAt();
                    uniqueKey = r.getUniqueKey();
                }
            }
        }
    }
}
