package com.urbanflux.complaints.output;

import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.exception.StoreException;
import com.urbanflux.complaints.model.Borough;
import com.urbanflux.complaints.model.ServiceRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.List;

/**
 * Bulk insert of clean service requests into PostgreSQL.
 *
 * Each call is one transaction: the records are split into multi-row INSERT statements of
 * at most loader.batch-size rows, and any failing statement rolls back the whole call.
 * Rows whose unique_key already exists are skipped by ON CONFLICT DO NOTHING and are not
 * counted as inserted, so loading the same batch twice inserts it once.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ServiceRequestLoader {

    static final int COLUMNS_PER_ROW = 8;

    /** PostgreSQL wire protocol limit on bind parameters per statement */
    static final int MAX_BIND_PARAMETERS = 65535;

    private static final String INSERT_PREFIX = """
            INSERT INTO service_requests
            (unique_key, created_at, closed_at, complaint_type, descriptor, borough, latitude, longitude)
            VALUES
            """;

    private static final String ROW_PLACEHOLDER = "(?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EtlProperties properties;

    /**
     * @return rows newly inserted; duplicates already in the table are not counted
     * @throws StoreException when any statement fails, in which case nothing from this call persists
     */
    public long bulkInsert(List<ServiceRequest> records) {
        if (records.isEmpty()) return 0;

        int batchSize = batchSize();
        int total = records.size();
        log.info("Bulk inserting {} records in statements of up to {} rows", total, batchSize);

        try {
            Long inserted = transactionTemplate.execute(status -> {
                long count = 0;
                for (int i = 0; i < total; i += batchSize) {
                    List<ServiceRequest> batch = records.subList(i, Math.min(i + batchSize, total));
                    count += jdbcTemplate.update(insertSql(batch.size()), ps -> bind(ps, batch));
                    log.debug("Wrote batch {}/{}", Math.min(i + batchSize, total), total);
                }
                return count;
            });
            long result = inserted == null ? 0 : inserted;
            log.info("Inserted {} new records ({} already present)", result, total - result);
            return result;

        } catch (DataAccessException | TransactionException e) {
            log.error("Bulk insert of {} records failed: {}", total, e.getMessage(), e);
            throw new StoreException("Bulk insert of " + total + " records failed: " + e.getMessage(), e);
        }
    }

    public long count() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM service_requests", Long.class);
            return count == null ? 0 : count;
        } catch (DataAccessException e) {
            throw new StoreException("Could not count service_requests: " + e.getMessage(), e);
        }
    }

    public OffsetDateTime latestCreatedAt() {
        try {
            return jdbcTemplate.queryForObject("SELECT MAX(created_at) FROM service_requests",
                    (rs, rowNum) -> rs.getObject(1, OffsetDateTime.class));
        } catch (DataAccessException e) {
            throw new StoreException("Could not read latest created_at: " + e.getMessage(), e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    int batchSize() {
        int configured = properties.getLoader().getBatchSize();
        int max = MAX_BIND_PARAMETERS / COLUMNS_PER_ROW;
        if (configured <= 0 || configured > max) {
            throw new IllegalStateException(
                    "urbanflux.loader.batch-size must be between 1 and " + max + ", got " + configured);
        }
        return configured;
    }

    static String insertSql(int rows) {
        return INSERT_PREFIX
                + String.join(",\n", Collections.nCopies(rows, ROW_PLACEHOLDER))
                + "\nON CONFLICT (unique_key) DO NOTHING";
    }

    private void bind(PreparedStatement ps, List<ServiceRequest> batch) throws SQLException {
        int idx = 1;
        for (ServiceRequest r : batch) {
            ps.setLong(idx++, r.getUniqueKey());
            ps.setObject(idx++, r.getCreatedAt(), Types.TIMESTAMP_WITH_TIMEZONE);
            ps.setObject(idx++, r.getClosedAt(), Types.TIMESTAMP_WITH_TIMEZONE);
            ps.setString(idx++, r.getComplaintType());
            ps.setString(idx++, r.getDescriptor());
            ps.setString(idx++, r.borough().map(Borough::label).orElse(null));
            ps.setObject(idx++, r.getLatitude(), Types.DOUBLE);
            ps.setObject(idx++, r.getLongitude(), Types.DOUBLE);
        }
    }
}
