package com.urbanflux.complaints.service;

import com.urbanflux.complaints.model.Coordinates;
import com.urbanflux.complaints.model.ServiceRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Domain rules a {@link ServiceRequest} must satisfy before it is loaded.
 * Returns every broken rule rather than stopping at the first.
 */
@Component
public class ServiceRequestValidator {

    public List<String> validate(ServiceRequest request) {
        List<String> errors = new ArrayList<>();

        if (request.getUniqueKey() <= 0) {
            errors.add("unique_key must be positive");
        }

        if (request.getCreatedAt() == null) {
            errors.add("created_at is required");
        }

        if (request.getComplaintType() == null || request.getComplaintType().isBlank()) {
            errors.add("complaint_type cannot be empty");
        }

        if (request.getClosedAt() != null && request.getCreatedAt() != null
                && request.getClosedAt().isBefore(request.getCreatedAt())) {
            errors.add("closed_at must be >= created_at");
        }

        // borough membership is enforced by its type
        request.coordinates()
                .filter(c -> !Coordinates.isWithinBounds(c.getLatitude(), c.getLongitude()))
                .ifPresent(c -> errors.add(String.format(
                        "coordinates out of NYC bounds: (%s, %s)", c.getLatitude(), c.getLongitude())));

        return errors;
    }
}
