package com.urbanflux.complaints.model;

import java.util.Locale;

/**
 * Lifecycle of an ETL run: RUNNING → COMPLETED | FAILED. Both terminal states are final.
 */
public enum RunStatus {

    RUNNING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean canTransitionTo(RunStatus next) {
        return this == RUNNING && next.isTerminal();
    }

    public static RunStatus fromDbValue(String raw) {
        switch (String.valueOf(raw)) {
            case "running":
                return RUNNING;
            case "completed":
                return COMPLETED;
            case "failed":
                return FAILED;
            default:
                throw new IllegalArgumentException("Unknown run status: " + raw);
        }
    }
}
