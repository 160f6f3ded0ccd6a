package com.urbanflux.complaints.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * A latitude/longitude pair inside the NYC bounding box.
 * Only obtainable through {@link #of(double, double)}, so an instance is always in bounds.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Coordinates {

    public static final double MIN_LATITUDE = 40.4;
    public static final double MAX_LATITUDE = 41.2;
    public static final double MIN_LONGITUDE = -74.3;
    public static final double MAX_LONGITUDE = -73.4;

    double latitude;
    double longitude;

    /** Empty when the pair falls outside the box (edges inclusive). */
    public static Optional<Coordinates> of(double latitude, double longitude) {
        return isWithinBounds(latitude, longitude)
                ? Optional.of(new Coordinates(latitude, longitude))
                : Optional.empty();
    }

    public static boolean isWithinBounds(double latitude, double longitude) {
        return latitude >= MIN_LATITUDE && latitude <= MAX_LATITUDE
                && longitude >= MIN_LONGITUDE && longitude <= MAX_LONGITUDE;
    }
}
