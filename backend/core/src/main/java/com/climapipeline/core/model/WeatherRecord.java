package com.climapipeline.core.model;

import com.climapipeline.core.error.DataIntegrityException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;

public record WeatherRecord(
        OffsetDateTime timestamp,
        Double temperatureC,
        Double humidityPct,
        Double precipitationMm,
        Double windSpeedKmh
) {
    public WeatherRecord {
        Objects.requireNonNull(timestamp, "timestamp is required");
        temperatureC = checked("temperature_c", temperatureC);
        humidityPct = checked("humidity_pct", humidityPct);
        precipitationMm = checked("precipitation_mm", precipitationMm);
        windSpeedKmh = checked("wind_speed_kmh", windSpeedKmh);
    }

    public Instant instant() {
        return timestamp.toInstant();
    }

    public Double value(VariableKind kind) {
        switch (kind) {
            case TEMPERATURE:
                return temperatureC;
            case HUMIDITY:
                return humidityPct;
            case PRECIPITATION:
                return precipitationMm;
            case WIND_SPEED:
                return windSpeedKmh;
            default:
                throw new IllegalArgumentException("Unhandled variable " + kind);
        }
    }

    // -0.0 is stored as 0.0 so that a written and re-read table compares equal.
    private static Double checked(String column, Double value) {
        if (value == null) {
            return null;
        }
        if (!Double.isFinite(value)) {
            throw new DataIntegrityException("Non-finite value " + value + " for " + column);
        }
        return value == 0.0 ? 0.0 : value;
    }
}
