package com.urbanflux.complaints.service;

import com.urbanflux.complaints.exception.FieldFormatException;
import com.urbanflux.complaints.exception.SemanticValidationException;
import com.urbanflux.complaints.model.Borough;
import com.urbanflux.complaints.model.Coordinates;
import com.urbanflux.complaints.model.RawServiceRequest;
import com.urbanflux.complaints.model.ServiceRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;

/**
 * Turns one raw CSV row into a {@link ServiceRequest}.
 *
 * Strict fields (row is rejected):
 *   unique key, created date, closed date when present, complaint type
 * Lenient fields (value is dropped, row is kept):
 *   borough outside the five boroughs, unparseable or out-of-bounds coordinates
 *
 * Timestamps carry no zone in the source and are read as UTC. Formats are tried in order:
 *   2025-01-01 10:00:00
 *   01/01/2025 10:00:00 AM
 *   2025-01-01T10:00:00
 *   2025-01-01 10:00
 *   2025-01-01            (midnight)
 */
@Component
@Slf4j
public class ServiceRequestParser {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("MM/dd/uuuu hh:mm:ss a"),
            strict("uuuu-MM-dd'T'HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm")
    );

    private static final DateTimeFormatter DATE_ONLY_FORMAT = strict("uuuu-MM-dd");

    public ServiceRequest parse(RawServiceRequest raw) {
        long uniqueKey = parseUniqueKey(raw.getUniqueKey());

        OffsetDateTime createdAt = parseTimestamp(raw.getCreatedDate());

        OffsetDateTime closedAt = null;
        if (!isBlank(raw.getClosedDate())) {
            closedAt = parseTimestamp(raw.getClosedDate());
            if (closedAt.isBefore(createdAt)) {
                throw new SemanticValidationException(String.format(
                        "closed_date %s is before created_date %s", closedAt, createdAt));
            }
        }

        String complaintType = emptyToNull(raw.getComplaintType());
        if (complaintType == null) {
            throw new SemanticValidationException("complaint_type cannot be empty");
        }

        return ServiceRequest.builder()
                .uniqueKey(uniqueKey)
                .createdAt(createdAt)
                .closedAt(closedAt)
                .complaintType(complaintType)
                .descriptor(emptyToNull(raw.getDescriptor()))
                .borough(parseBorough(raw.getBorough(), uniqueKey))
                .coordinates(parseCoordinates(raw.getLatitude(), raw.getLongitude()))
                .build();
    }

    /**
     * Parse a source timestamp as UTC, first matching format wins.
     *
     * @throws FieldFormatException naming the offending value when no format matches
     */
    public static OffsetDateTime parseTimestamp(String value) {
        String s = value == null ? "" : value.trim();

        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(s, format).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }

        try {
            return LocalDate.parse(s, DATE_ONLY_FORMAT).atStartOfDay().atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new FieldFormatException("Unable to parse date: '" + value + "'", e);
        }
    }

    // ── Field helpers ─────────────────────────────────────────────────────────

    private long parseUniqueKey(String value) {
        long key;
        try {
            key = Long.parseLong(value == null ? "" : value.trim());
        } catch (NumberFormatException e) {
            throw new FieldFormatException("Invalid unique_key: '" + value + "'", e);
        }
        if (key <= 0) {
            throw new FieldFormatException("unique_key must be positive: " + key);
        }
        return key;
    }

    private Borough parseBorough(String value, long uniqueKey) {
        if (isBlank(value)) return null;
        Borough borough = Borough.fromLabel(value).orElse(null);
        if (borough == null) {
            log.debug("Dropping unrecognised borough '{}' on unique_key {}", value.trim(), uniqueKey);
        }
        return borough;
    }

    private Coordinates parseCoordinates(String latitude, String longitude) {
        Double lat = parseDouble(latitude);
        Double lng = parseDouble(longitude);
        if (lat == null || lng == null) return null;
        return Coordinates.of(lat, lng).orElse(null);
    }

    private Double parseDouble(String val) {
        if (isBlank(val)) return null;
        try {
            double d = Double.parseDouble(val.trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static boolean isBlank(String val) {
        return val == null || val.isBlank();
    }

    private static String emptyToNull(String val) {
        return isBlank(val) ? null : val.trim();
    }
}
