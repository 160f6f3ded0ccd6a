package com.urbanflux.complaints.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * One NYC 311 service request, normalised and ready for the service_requests table.
 *
 * Field notes:
 *  - uniqueKey is the natural key; the table's primary key and the dedup key for a run
 *  - borough and coordinates are nullable; unrecognised or out-of-bounds input is dropped, not rejected
 *  - all text fields are trimmed before they get here
 */
@Value
@Builder(toBuilder = true)
public class ServiceRequest {

    long uniqueKey;

    /** UTC */
    OffsetDateTime createdAt;

    /** UTC, null while the request is open */
    OffsetDateTime closedAt;

    /** e.g. "Noise - Residential", "HEAT/HOT WATER" */
    String complaintType;

    String descriptor;

    Borough borough;

    Coordinates coordinates;

    public Optional<Borough> borough() {
        return Optional.ofNullable(borough);
    }

    public Optional<Coordinates> coordinates() {
        return Optional.ofNullable(coordinates);
    }

    public Double getLatitude() {
        return coordinates == null ? null : coordinates.getLatitude();
    }

    public Double getLongitude() {
        return coordinates == null ? null : coordinates.getLongitude();
    }
}
