package com.urbanflux.complaints.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The five NYC boroughs. Absence of a borough is modelled as an empty {@link Optional},
 * never as an extra constant.
 */
public enum Borough {

    BRONX("BRONX"),
    BROOKLYN("BROOKLYN"),
    MANHATTAN("MANHATTAN"),
    QUEENS("QUEENS"),
    STATEN_ISLAND("STATEN ISLAND");

    private final String label;

    Borough(String label) {
        this.label = label;
    }

    /** Value stored in the {@code borough} column, e.g. "STATEN ISLAND". */
    public String label() {
        return label;
    }

    /**
     * Case-insensitive, whitespace-trimmed lookup.
     * e.g. "  staten island " → STATEN_ISLAND, "Unspecified" → empty
     */
    public static Optional<Borough> fromLabel(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String normalised = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(b -> b.label.equals(normalised))
                .findFirst();
    }
}
