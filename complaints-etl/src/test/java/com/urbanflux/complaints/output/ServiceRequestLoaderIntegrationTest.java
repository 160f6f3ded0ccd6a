package com.urbanflux.complaints.output;

import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.exception.StoreException;
import com.urbanflux.complaints.model.Borough;
import com.urbanflux.complaints.model.ServiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Loads against a real PostgreSQL so ON CONFLICT and transaction rollback behave as in production.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ServiceRequestLoader PostgreSQL Integration Tests")
class ServiceRequestLoaderIntegrationTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2025, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    private JdbcTemplate jdbcTemplate;
    private ServiceRequestLoader loader;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        jdbcTemplate = new JdbcTemplate(dataSource);
        new SchemaInitializer(jdbcTemplate).ensureSchema();
        jdbcTemplate.update("TRUNCATE service_requests");

        EtlProperties properties = new EtlProperties();
        properties.getLoader().setBatchSize(3);
        loader = new ServiceRequestLoader(jdbcTemplate,
            new TransactionTemplate(new DataSourceTransactionManager(dataSource)), properties);
    }

    @Test
    @DisplayName("Should insert a batch once and report zero on reload")
    void shouldBeIdempotent() {
        // Given
        List<ServiceRequest> batch = records(1, 7);

        // When
        long first = loader.bulkInsert(batch);
        long second = loader.bulkInsert(batch);

        // Then
        assertThat(first).isEqualTo(7);
        assertThat(second).isZero();
        assertThat(loader.count()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should count only new keys when a batch overlaps stored rows")
    void shouldCountOnlyNewRows() {
        loader.bulkInsert(records(1, 4));

        assertThat(loader.bulkInsert(records(3, 6))).isEqualTo(2);
        assertThat(loader.count()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should roll back the whole call when a later statement fails")
    void shouldRollBackWholeCall() {
        // Given: the failing row sits in the third statement
        List<ServiceRequest> batch = new ArrayList<>(records(1, 6));
        batch.add(ServiceRequest.builder().uniqueKey(99).createdAt(T0).complaintType("x".repeat(300)).build());

        // When / Then
        assertThatThrownBy(() -> loader.bulkInsert(batch)).isInstanceOf(StoreException.class);
        assertThat(loader.count()).isZero();
    }

    @Test
    @DisplayName("Should round-trip timestamps in UTC and boroughs by label")
    void shouldStoreValues() {
        loader.bulkInsert(List.of(ServiceRequest.builder()
            .uniqueKey(5).createdAt(T0).complaintType("Noise").borough(Borough.STATEN_ISLAND).build()));

        assertThat(loader.latestCreatedAt()).isAtSameInstantAs(T0);
        assertThat(jdbcTemplate.queryForObject(
            "SELECT borough FROM service_requests WHERE unique_key = 5", String.class))
            .isEqualTo("STATEN ISLAND");
    }

    private static List<ServiceRequest> records(long from, long to) {
        return LongStream.rangeClosed(from, to)
            .mapToObj(key -> ServiceRequest.builder()
                .uniqueKey(key)
                .createdAt(T0.plusMinutes(key))
                .complaintType("Noise")
                .build())
            .toList();
    }
}
