package com.urbanflux.complaints.config;

import com.urbanflux.complaints.model.EtlMode;
import com.urbanflux.complaints.model.EtlRun;
import com.urbanflux.complaints.model.Watermark;
import com.urbanflux.complaints.output.RunTracker;
import com.urbanflux.complaints.output.ServiceRequestLoader;
import com.urbanflux.complaints.service.EtlPipelineService;
import com.urbanflux.complaints.service.EtlRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/etl")
@Slf4j
@RequiredArgsConstructor
public class EtlController {

    private final EtlPipelineService pipelineService;
    private final RunTracker runTracker;
    private final ServiceRequestLoader loader;
    private final EtlProperties properties;

    // ── Run triggers ──────────────────────────────────────────────────────────

    /**
     * Start a run in the background.
     *
     * POST /etl/run?mode=incremental&input=/data/311.csv&chunkSize=50000&dryRun=false
     *
     * Any parameter left out falls back to the urbanflux.etl.* configuration.
     */
    @PostMapping("/run")
    public ResponseEntity<Map<String, String>> triggerRun(
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) String input,
            @RequestParam(required = false) Integer chunkSize,
            @RequestParam(required = false) Boolean dryRun) {

        EtlProperties.Etl defaults = properties.getEtl();
        EtlRequest request;
        try {
            request = new EtlRequest(
                    EtlMode.parse(mode != null ? mode : defaults.getMode()),
                    input != null ? input : defaults.getInputPath(),
                    chunkSize != null ? chunkSize : defaults.getChunkSize(),
                    dryRun != null ? dryRun : defaults.isDryRun());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }

        if (pipelineService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "An ETL run is already in progress"));
        }

        new Thread(() -> {
            try {
                pipelineService.run(request);
            } catch (RuntimeException e) {
                log.error("Manual ETL run failed: {}", e.getMessage());
            }
        }, "manual-etl-" + request.getMode().dbValue()).start();

        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "mode", request.getMode().dbValue(),
                "input", request.getInput(),
                "dryRun", String.valueOf(request.isDryRun())));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        if (!pipelineService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "No ETL run in progress"));
        }
        pipelineService.requestStop();
        return ResponseEntity.accepted().body(Map.of("status", "stopping"));
    }

    // ── Reporting ─────────────────────────────────────────────────────────────

    @GetMapping("/runs/latest")
    public ResponseEntity<EtlRun> latestRun() {
        return runTracker.latestRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/watermark")
    public ResponseEntity<Watermark> watermark() {
        return runTracker.lastWatermark()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/status")
    public ResponseEntity<?> status() {
        try {
            OffsetDateTime latest = loader.latestCreatedAt();
            Map<String, Object> body = new HashMap<>();
            body.put("service", "urbanflux-complaints-etl");
            body.put("running", pipelineService.isRunning());
            body.put("recordsInStore", loader.count());
            body.put("latestCreatedAt", latest);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Status query failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
