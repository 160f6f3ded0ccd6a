package com.urbanflux.complaints.model;

import java.util.Locale;

public enum EtlMode {

    FULL,
    INCREMENTAL;

    /** Value stored in {@code etl_watermarks.run_mode}. */
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EtlMode parse(String raw) {
        String normalised = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (normalised) {
            case "full":
                return FULL;
            case "incremental":
                return INCREMENTAL;
            default:
                throw new IllegalArgumentException(
                        "Invalid ETL mode: " + raw + " (expected full or incremental)");
        }
    }
}
