package com.urbanflux.complaints.scheduler;

import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.output.SchemaInitializer;
import com.urbanflux.complaints.service.EtlPipelineService;
import com.urbanflux.complaints.service.EtlRequest;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages on-startup and scheduled runs.
 *
 * No schedule by default; set CRON (urbanflux.scheduling.cron) to enable a recurring
 * incremental run against the configured input.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EtlScheduler {

    private final EtlPipelineService pipelineService;
    private final SchemaInitializer schemaInitializer;
    private final EtlProperties properties;

    /**
     * On application startup:
     *  1. Ensure the database schema exists
     *  2. Optionally run the configured pipeline if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            schemaInitializer.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise database schema (dry run only?): {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running {} pipeline", properties.getEtl().getMode());
            try {
                pipelineService.run(EtlRequest.fromProperties(properties));
            } catch (Exception e) {
                log.error("Startup run failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("ETL ready. Schedule: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${urbanflux.scheduling.cron:-}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled incremental run triggered");
        try {
            pipelineService.run(EtlRequest.fromProperties(properties).withMode(EtlMode.INCREMENTAL));
        } catch (Exception e) {
            log.error("Scheduled run failed: {}", e.getMessage(), e);
        }
    }
}
