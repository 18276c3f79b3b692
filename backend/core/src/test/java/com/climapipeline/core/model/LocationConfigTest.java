package com.climapipeline.core.model;

import com.climapipeline.core.error.ErrorKind;
import com.climapipeline.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationConfigTest {
    @Test
    void acceptsBoundaryCoordinates() {
        assertDoesNotThrow(() -> new LocationConfig("North Pole", 90.0, 180.0, "UTC"));
        assertDoesNotThrow(() -> new LocationConfig("South Pole", -90.0, -180.0, "UTC"));
    }

    @Test
    void rejectsOutOfRangeLatitudeInsteadOfClamping() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> new LocationConfig("Nowhere", 91.0, 0.0, "UTC"));

        assertEquals(ErrorKind.VALIDATION, error.kind());
        assertTrue(error.getMessage().contains("Latitude"));
    }

    @Test
    void rejectsOutOfRangeOrNonFiniteLongitude() {
        assertThrows(ValidationException.class, () -> new LocationConfig("East", 0.0, 180.5, "UTC"));
        assertThrows(ValidationException.class, () -> new LocationConfig("NaN", 0.0, Double.NaN, "UTC"));
    }

    @Test
    void rejectsMissingCoordinates() {
        ValidationException error = assertThrows(ValidationException.class,
                () -> new LocationConfig("Nowhere", null, 0.0, "UTC"));

        assertTrue(error.getMessage().contains("required"));
        assertThrows(ValidationException.class, () -> new LocationConfig("Nowhere", 0.0, null, "UTC"));
    }

    @Test
    void rejectsBlankNameAndUnknownTimezone() {
        assertThrows(ValidationException.class, () -> new LocationConfig(" ", 6.2, -75.5, "America/Bogota"));
        assertThrows(ValidationException.class, () -> new LocationConfig("Medellín", 6.2, -75.5, "Mars/Olympus"));
        assertThrows(ValidationException.class, () -> new LocationConfig("Medellín", 6.2, -75.5, null));
    }

    @Test
    void exposesZoneId() {
        LocationConfig location = new LocationConfig("Medellín", 6.244, -75.581, "America/Bogota");
        assertEquals(ZoneId.of("America/Bogota"), location.zoneId());
    }
}
