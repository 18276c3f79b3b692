package com.climapipeline.core.model;

import com.climapipeline.core.error.ValidationException;

import java.time.DateTimeException;
import java.time.ZoneId;

public record LocationConfig(
        String name,
        Double latitude,
        Double longitude,
        String timezone
) {
    public LocationConfig {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Location name is required");
        }
        if (latitude == null || longitude == null) {
            throw new ValidationException("Latitude and longitude are required for location " + name);
        }
        validateCoordinates(latitude, longitude);
        if (timezone == null || timezone.isBlank()) {
            throw new ValidationException("Timezone is required for location " + name);
        }
        try {
            ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone '" + timezone + "' for location " + name, e);
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public static void validateCoordinates(double latitude, double longitude) {
        if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new ValidationException("Latitude must be between -90 and 90, got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new ValidationException("Longitude must be between -180 and 180, got " + longitude);
        }
    }
}
