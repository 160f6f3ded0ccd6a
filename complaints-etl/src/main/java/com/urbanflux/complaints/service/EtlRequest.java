package com.urbanflux.complaints.service;

import com.urbanflux.complaints.config.EtlProperties;
import com.urbanflux.complaints.model.EtlMode;
import lombok.Value;

/**
 * Parameters for one pipeline run.
 */
@Value
public class EtlRequest {

    EtlMode mode;
    String input;
    int chunkSize;
    boolean dryRun;

    public EtlRequest(EtlMode mode, String input, int chunkSize, boolean dryRun) {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("input path or URL is required");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        this.mode = mode;
        this.input = input;
        this.chunkSize = chunkSize;
        this.dryRun = dryRun;
    }

    public static EtlRequest fromProperties(EtlProperties properties) {
        EtlProperties.Etl etl = properties.getEtl();
        return new EtlRequest(EtlMode.parse(etl.getMode()), etl.getInputPath(), etl.getChunkSize(), etl.isDryRun());
    }

    public EtlRequest withMode(EtlMode newMode) {
        return new EtlRequest(newMode, input, chunkSize, dryRun);
    }
}
