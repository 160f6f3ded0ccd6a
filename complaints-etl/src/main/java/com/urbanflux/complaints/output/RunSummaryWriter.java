package com.urbanflux.complaints.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.model.EtlRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Drops a JSON summary of each finished run into {runsDir}/run_{runLabel}.json.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunSummaryWriter {

    private final ObjectMapper objectMapper;
    private final EtlProperties properties;

    /** Best effort: a failure is logged and never affects the run's outcome. */
    public void write(String runLabel, EtlRun run) {
        Path outputPath = Paths.get(properties.getEtl().getRunsDir())
                .resolve(String.format("run_%s.json", runLabel));
        try {
            Files.createDirectories(outputPath.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), run);
            log.info("Run summary written to {}", outputPath);
        } catch (IOException e) {
            log.warn("Failed to write run summary {}: {}", outputPath, e.getMessage());
        }
    }
}
