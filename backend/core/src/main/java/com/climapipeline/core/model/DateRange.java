package com.climapipeline.core.model;

import com.climapipeline.core.error.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

public record DateRange(LocalDate startDate, LocalDate endDate) {
    public static final int MAX_FORECAST_DAYS = 16;

    public DateRange {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Both start and end date are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new ValidationException("Start date " + startDate + " is after end date " + endDate);
        }
    }

    public static DateRange today(ZoneId zone, Clock clock) {
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return new DateRange(today, today);
    }

    public static DateRange nextDays(ZoneId zone, Clock clock, int days) {
        if (days < 1 || days > MAX_FORECAST_DAYS) {
            throw new ValidationException("Forecast days must be between 1 and " + MAX_FORECAST_DAYS + ", got " + days);
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        return new DateRange(today, today.plusDays(days - 1L));
    }
}
