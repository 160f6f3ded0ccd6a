package com.urbanflux.complaints.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the two tables the pipeline writes to when they do not exist yet.
 * Materialized views and migrations are managed outside this service.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring database schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS service_requests
            (
                unique_key          BIGINT PRIMARY KEY,
                created_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                closed_at           TIMESTAMP WITH TIME ZONE,
                complaint_type      VARCHAR(255) NOT NULL,
                descriptor          VARCHAR(1024),
                borough             VARCHAR(20)
                    CHECK (borough IN ('BRONX', 'BROOKLYN', 'MANHATTAN', 'QUEENS', 'STATEN ISLAND')),
                latitude            DOUBLE PRECISION,
                longitude           DOUBLE PRECISION,
                ingested_at         TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
            )
        """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_service_requests_created_at ON service_requests (created_at)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_service_requests_borough ON service_requests (borough)");
        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_service_requests_complaint_type ON service_requests (complaint_type)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS etl_watermarks
            (
                run_id              UUID PRIMARY KEY,
                run_mode            VARCHAR(20) NOT NULL CHECK (run_mode IN ('full', 'incremental')),
                status              VARCHAR(20) NOT NULL CHECK (status IN ('running', 'completed', 'failed')),
                started_at          TIMESTAMP WITH TIME ZONE NOT NULL,
                completed_at        TIMESTAMP WITH TIME ZONE,
                last_created_at     TIMESTAMP WITH TIME ZONE,
                last_unique_key     BIGINT,
                rows_read           BIGINT DEFAULT 0 NOT NULL,
                rows_processed      BIGINT DEFAULT 0 NOT NULL,
                rows_validated      BIGINT DEFAULT 0 NOT NULL,
                rows_inserted       BIGINT DEFAULT 0 NOT NULL,
                rows_duplicated     BIGINT DEFAULT 0 NOT NULL,
                rows_rejected       BIGINT DEFAULT 0 NOT NULL,
                rows_skipped        BIGINT DEFAULT 0 NOT NULL,
                parse_errors        BIGINT DEFAULT 0 NOT NULL,
                validation_errors   BIGINT DEFAULT 0 NOT NULL,
                error_message       VARCHAR(4000)
            )
        """);

        jdbcTemplate.execute(
                "CREATE INDEX IF NOT EXISTS idx_etl_watermarks_status_completed ON etl_watermarks (status, completed_at)");

        log.info("Database schema ready.");
    }
}
