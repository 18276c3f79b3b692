package com.climapipeline.collectors.openmeteo;

import com.climapipeline.collectors.api.WeatherClient;
import com.climapipeline.core.error.HttpStatusException;
import com.climapipeline.core.error.NetworkException;
import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public final class OpenMeteoClient implements WeatherClient {
    public static final URI DEFAULT_BASE_URI = URI.create("https://api.open-meteo.com");
    private static final Logger LOGGER = Logger.getLogger(OpenMeteoClient.class.getName());
    private static final int MAX_REASON_LENGTH = 200;

    private final HttpClient httpClient;
    private final URI baseUri;
    private final Duration timeout;
    private final Clock clock;
    private final String userAgent;
    private final OpenMeteoResponseParser parser = new OpenMeteoResponseParser();

    public OpenMeteoClient(HttpClient httpClient, URI baseUri, Duration timeout, Clock clock, String userAgent) {
        this.httpClient = httpClient;
        this.baseUri = baseUri;
        this.timeout = timeout;
        this.clock = clock;
        this.userAgent = userAgent;
    }

    @Override
    public RawWeatherResponse fetch(LocationConfig location, DateRange range, Set<VariableKind> variables) {
        if (location == null) {
            throw new ValidationException("Location is required");
        }
        LocationConfig.validateCoordinates(location.latitude(), location.longitude());
        if (variables == null || variables.isEmpty()) {
            throw new ValidationException("At least one weather variable must be requested");
        }
        Set<VariableKind> requested = EnumSet.copyOf(variables);
        DateRange effective = range == null ? DateRange.today(location.zoneId(), clock) : range;
        URI uri = requestUri(location, effective, requested);

        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() / 100 != 2) {
            throw new HttpStatusException(response.statusCode(), "Open-Meteo request failed with status "
                    + response.statusCode() + " for " + location.name() + reasonSuffix(response.body()));
        }
        LOGGER.fine(() -> "Open-Meteo answered " + response.statusCode() + " for " + uri);
        return parser.parse(response.body(), location, requested);
    }

    URI requestUri(LocationConfig location, DateRange range, Set<VariableKind> variables) {
        String hourly = variables.stream()
                .sorted()
                .map(VariableKind::providerCode)
                .collect(Collectors.joining(","));
        String base = baseUri.toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + "/v1/forecast"
                + "?latitude=" + plain(location.latitude())
                + "&longitude=" + plain(location.longitude())
                + "&hourly=" + encode(hourly)
                + "&start_date=" + range.startDate()
                + "&end_date=" + range.endDate()
                + "&timezone=" + encode(location.timezone()));
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new NetworkException("Open-Meteo request timed out after " + timeout.toMillis() + " ms", e);
        } catch (IOException e) {
            throw new NetworkException("Open-Meteo request failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Open-Meteo request was interrupted", e);
        }
    }

    private static String reasonSuffix(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode reason = JsonUtils.objectMapper().readTree(body).path("reason");
            if (reason.isTextual() && !reason.asText().isBlank()) {
                return ": " + truncate(reason.asText());
            }
        } catch (JsonProcessingException e) {
            LOGGER.fine(() -> "Error body is not JSON: " + e.getOriginalMessage());
        }
        return ": " + truncate(body.strip());
    }

    private static String truncate(String text) {
        return text.length() <= MAX_REASON_LENGTH ? text : text.substring(0, MAX_REASON_LENGTH) + "...";
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
