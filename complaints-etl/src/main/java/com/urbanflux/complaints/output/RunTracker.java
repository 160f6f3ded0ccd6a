package com.urbanflux.complaints.output;

import com.urbanflux.complaints.exception.StoreException;
import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.model.EtlRun;
import com.urbanflux.complaints.model.EtlStats;
import com.urbanflux.complaints.model.RunStatus;
import com.urbanflux.complaints.model.Watermark;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run log in the etl_watermarks table.
 *
 * A run is inserted as running by {@link #start} and updated once, by either {@link #complete}
 * or {@link #fail}. Updates only match rows still in the running state, so a finished run is
 * never reopened. The last completed run is the sole source of the incremental resume point.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunTracker {

    private static final String SELECT_RUN = """
            SELECT run_id, run_mode, status, started_at, completed_at, last_created_at, last_unique_key,
                   rows_read, rows_processed, rows_validated, rows_inserted, rows_duplicated,
                   rows_rejected, rows_skipped, parse_errors, validation_errors, error_message
            FROM etl_watermarks
            """;

    private static final RowMapper<EtlRun> RUN_MAPPER = RunTracker::mapRun;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public UUID start(EtlMode mode) {
        UUID runId = UUID.randomUUID();
        try {
            jdbcTemplate.update(
                    "INSERT INTO etl_watermarks (run_id, run_mode, status, started_at) VALUES (?, ?, ?, ?)",
                    runId, mode.dbValue(), RunStatus.RUNNING.dbValue(), now());
        } catch (DataAccessException e) {
            throw new StoreException("Could not record start of " + mode.dbValue() + " run: " + e.getMessage(), e);
        }
        log.info("Started {} run {}", mode.dbValue(), runId);
        return runId;
    }

    /**
     * @param lastCreatedAt  resume point for the next incremental run, null if none
     * @param lastUniqueKey  key of the record at the resume point, null if none
     */
    public void complete(UUID runId, EtlStats stats, OffsetDateTime lastCreatedAt, Long lastUniqueKey) {
        int updated;
        try {
            updated = jdbcTemplate.update("""
                    UPDATE etl_watermarks
                    SET status = ?,
                        completed_at = ?,
                        last_created_at = ?,
                        last_unique_key = ?,
                        rows_read = ?,
                        rows_processed = ?,
                        rows_validated = ?,
                        rows_inserted = ?,
                        rows_duplicated = ?,
                        rows_rejected = ?,
                        rows_skipped = ?,
                        parse_errors = ?,
                        validation_errors = ?
                    WHERE run_id = ? AND status = ?
                    """,
                    RunStatus.COMPLETED.dbValue(), now(), lastCreatedAt, lastUniqueKey,
                    stats.getRowsRead(), stats.getRowsParsed(), stats.getRowsValidated(),
                    stats.getRowsInserted(), stats.getRowsDuplicated(), stats.getRowsRejected(),
                    stats.getRowsSkipped(), stats.getParseErrors(), stats.getValidationErrors(),
                    runId, RunStatus.RUNNING.dbValue());
        } catch (DataAccessException e) {
            throw new StoreException("Could not complete run " + runId + ": " + e.getMessage(), e);
        }
        requireTransition(runId, updated, RunStatus.COMPLETED);
        log.info("Run {} completed", runId);
    }

    public void fail(UUID runId, String errorMessage) {
        int updated;
        try {
            updated = jdbcTemplate.update("""
                    UPDATE etl_watermarks
                    SET status = ?, completed_at = ?, error_message = ?
                    WHERE run_id = ? AND status = ?
                    """,
                    RunStatus.FAILED.dbValue(), now(), truncate(errorMessage),
                    runId, RunStatus.RUNNING.dbValue());
        } catch (DataAccessException e) {
            throw new StoreException("Could not mark run " + runId + " as failed: " + e.getMessage(), e);
        }
        requireTransition(runId, updated, RunStatus.FAILED);
        log.warn("Run {} failed: {}", runId, errorMessage);
    }

    /**
     * Resume point of the most recently completed run, empty if no run has ever completed.
     */
    public Optional<Watermark> lastWatermark() {
        return queryOne(SELECT_RUN + " WHERE status = ? ORDER BY completed_at DESC, started_at DESC",
                RunStatus.COMPLETED.dbValue())
                .map(run -> new Watermark(run.getRunId(), run.getLastCreatedAt(),
                        run.getLastUniqueKey(), run.getRunMode()));
    }

    /** Most recently started run in any state. */
    public Optional<EtlRun> latestRun() {
        return queryOne(SELECT_RUN + " ORDER BY started_at DESC");
    }

    public Optional<EtlRun> findRun(UUID runId) {
        return queryOne(SELECT_RUN + " WHERE run_id = ?", runId);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private Optional<EtlRun> queryOne(String sql, Object... args) {
        try {
            List<EtlRun> rows = jdbcTemplate.query(sql + " LIMIT 1", RUN_MAPPER, args);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new StoreException("Could not read etl_watermarks: " + e.getMessage(), e);
        }
    }

    private void requireTransition(UUID runId, int updated, RunStatus target) {
        if (!RunStatus.RUNNING.canTransitionTo(target)) {
            throw new IllegalArgumentException("Not a terminal run status: " + target);
        }
        if (updated == 0) {
            throw new IllegalStateException(
                    "Run " + runId + " cannot move to " + target.dbValue() + ": not found or not running");
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= 4000 ? message : message.substring(0, 4000);
    }

    private static EtlRun mapRun(ResultSet rs, int rowNum) throws SQLException {
        return EtlRun.builder()
                .runId(rs.getObject("run_id", UUID.class))
                .runMode(EtlMode.parse(rs.getString("run_mode")))
                .status(RunStatus.fromDbValue(rs.getString("status")))
                .startedAt(rs.getObject("started_at", OffsetDateTime.class))
                .completedAt(rs.getObject("completed_at", OffsetDateTime.class))
                .lastCreatedAt(rs.getObject("last_created_at", OffsetDateTime.class))
                .lastUniqueKey(rs.getObject("last_unique_key", Long.class))
                .stats(EtlStats.builder()
                        .rowsRead(rs.getLong("rows_read"))
                        .rowsParsed(rs.getLong("rows_processed"))
                        .rowsValidated(rs.getLong("rows_validated"))
                        .rowsInserted(rs.getLong("rows_inserted"))
                        .rowsDuplicated(rs.getLong("rows_duplicated"))
                        .rowsRejected(rs.getLong("rows_rejected"))
                        .rowsSkipped(rs.getLong("rows_skipped"))
                        .parseErrors(rs.getLong("parse_errors"))
                        .validationErrors(rs.getLong("validation_errors"))
                        .build())
                .errorMessage(rs.getString("error_message"))
                .build();
    }
}
