package com.climapipeline.service.config;

import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WriteMode;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

public record PipelineConfig(
        LocationConfig location,
        List<String> variables,
        Dates dates,
        Output output,
        Http http,
        Cache cache,
        Retry retry,
        String eventLog
) {
    public static final LocationConfig DEFAULT_LOCATION =
            new LocationConfig("Medellín", 6.244, -75.581, "America/Bogota");
    public static final List<String> DEFAULT_VARIABLES =
            List.of("temperature", "humidity", "precipitation", "wind_speed");

    public PipelineConfig {
        location = location == null ? DEFAULT_LOCATION : location;
        variables = variables == null ? DEFAULT_VARIABLES : List.copyOf(variables);
        dates = dates == null ? new Dates(null, null, null) : dates;
        output = output == null ? new Output(null, null, null, false) : output;
        http = http == null ? new Http(null, null, null, null, null) : http;
        cache = cache == null ? new Cache(null, null, null) : cache;
        retry = retry == null ? new Retry(null, null) : retry;
        eventLog = eventLog == null || eventLog.isBlank() ? "logs/events.jsonl" : eventLog;
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null, null, null, null);
    }

    public PipelineConfig withLocation(LocationConfig newLocation) {
        return new PipelineConfig(newLocation, variables, dates, output, http, cache, retry, eventLog);
    }

    public PipelineConfig withMode(WriteMode mode) {
        return new PipelineConfig(location, variables, dates,
                new Output(output.directory(), output.filename(), mode, output.includeTimestamp()),
                http, cache, retry, eventLog);
    }

    public Set<VariableKind> variableKinds() {
        if (variables.isEmpty()) {
            throw new ValidationException("At least one weather variable must be configured");
        }
        return VariableKind.parseAll(variables);
    }

    public record Dates(LocalDate startDate, LocalDate endDate, Integer forecastDays) {
        public Dates {
            if ((startDate == null) != (endDate == null)) {
                throw new ValidationException("startDate and endDate must be given together");
            }
            if (startDate != null && forecastDays != null) {
                throw new ValidationException("Use either startDate/endDate or forecastDays, not both");
            }
        }

        public DateRange resolve(ZoneId zone, Clock clock) {
            if (startDate != null) {
                return new DateRange(startDate, endDate);
            }
            if (forecastDays != null) {
                return DateRange.nextDays(zone, clock, forecastDays);
            }
            return DateRange.today(zone, clock);
        }
    }

    public record Output(String directory, String filename, WriteMode mode, boolean includeTimestamp) {
        public Output {
            directory = directory == null || directory.isBlank() ? "data" : directory;
            filename = filename == null || filename.isBlank() ? "weather_data.csv" : filename;
            mode = mode == null ? WriteMode.OVERWRITE : mode;
        }
    }

    public record Http(
            String baseUrl,
            Duration connectTimeout,
            Duration requestTimeout,
            String userAgent,
            String fixtureFile
    ) {
        public Http {
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.open-meteo.com" : baseUrl;
            connectTimeout = positiveOrDefault(connectTimeout, Duration.ofSeconds(5), "connectTimeout");
            requestTimeout = positiveOrDefault(requestTimeout, Duration.ofSeconds(10), "requestTimeout");
            userAgent = userAgent == null || userAgent.isBlank() ? "clima-pipeline/0.1" : userAgent;
        }
    }

    public record Cache(Boolean enabled, String directory, Duration ttl) {
        public Cache {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            directory = directory == null || directory.isBlank() ? "cache" : directory;
            ttl = positiveOrDefault(ttl, Duration.ofMinutes(15), "ttl");
        }
    }

    public record Retry(Integer maxAttempts, Duration backoff) {
        public Retry {
            maxAttempts = maxAttempts == null ? 1 : maxAttempts;
            if (maxAttempts < 1) {
                throw new ValidationException("retry.maxAttempts must be at least 1, got " + maxAttempts);
            }
            backoff = backoff == null ? Duration.ofSeconds(2) : backoff;
            if (backoff.isNegative()) {
                throw new ValidationException("retry.backoff must not be negative");
            }
        }
    }

    private static Duration positiveOrDefault(Duration value, Duration fallback, String field) {
        if (value == null) {
            return fallback;
        }
        if (value.isZero() || value.isNegative()) {
            throw new ValidationException(field + " must be positive, got " + value);
        }
        return value;
    }
}
