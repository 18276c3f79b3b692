package com.climapipeline.collectors.transform;

import com.climapipeline.core.error.DataIntegrityException;
import com.climapipeline.core.error.IncompleteDataException;
import com.climapipeline.core.error.MalformedResponseException;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WeatherDataset;
import com.climapipeline.core.model.WeatherRecord;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public final class WeatherTransformer {
    private static final Logger LOGGER = Logger.getLogger(WeatherTransformer.class.getName());
    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter();
    // JSON number grammar; rejects NaN, Infinity and hex floats that Double.parseDouble would accept.
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");

    public WeatherDataset normalize(RawWeatherResponse raw) {
        for (VariableKind kind : raw.requested()) {
            if (!raw.samples().containsKey(kind)) {
                throw new IncompleteDataException("Response is missing requested variable '"
                        + kind.providerCode() + "' for " + raw.location().name());
            }
        }
        if (!raw.unrecognizedKeys().isEmpty()) {
            LOGGER.fine(() -> "Dropping unrecognized hourly keys " + raw.unrecognizedKeys());
        }

        ZoneId zone = raw.location().zoneId();
        List<String> time = raw.time();
        List<WeatherRecord> rows = new ArrayList<>(time.size());
        for (int i = 0; i < time.size(); i++) {
            OffsetDateTime timestamp = parseTimestamp(time.get(i), zone);
            Map<VariableKind, Double> values = new EnumMap<>(VariableKind.class);
            for (Map.Entry<VariableKind, List<String>> series : raw.samples().entrySet()) {
                List<String> tokens = series.getValue();
                if (tokens.size() != time.size()) {
                    throw new MalformedResponseException("Variable '" + series.getKey().providerCode()
                            + "' has " + tokens.size() + " samples for " + time.size() + " timestamps");
                }
                values.put(series.getKey(), coerce(series.getKey(), tokens.get(i), time.get(i)));
            }
            rows.add(new WeatherRecord(
                    timestamp,
                    values.get(VariableKind.TEMPERATURE),
                    values.get(VariableKind.HUMIDITY),
                    values.get(VariableKind.PRECIPITATION),
                    values.get(VariableKind.WIND_SPEED)
            ));
        }
        WeatherDataset dataset = WeatherDataset.normalize(rows);
        if (dataset.size() != rows.size()) {
            LOGGER.fine(() -> "Collapsed " + (rows.size() - dataset.size()) + " duplicate timestamps");
        }
        return dataset;
    }

    static OffsetDateTime parseTimestamp(String text, ZoneId zone) {
        TemporalAccessor parsed;
        try {
            parsed = TIMESTAMP.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Unparseable timestamp '" + text + "'", e);
        }
        if (parsed instanceof OffsetDateTime withOffset) {
            return withOffset;
        }
        LocalDateTime local = (LocalDateTime) parsed;
        List<ZoneOffset> offsets = zone.getRules().getValidOffsets(local);
        if (offsets.size() != 1) {
            throw new MalformedResponseException("Timestamp '" + text + "' is "
                    + (offsets.isEmpty() ? "skipped" : "ambiguous") + " in timezone " + zone);
        }
        return OffsetDateTime.of(local, offsets.get(0));
    }

    static Double coerce(VariableKind kind, String token, String timestamp) {
        if (token == null) {
            return null;
        }
        if (!NUMBER.matcher(token).matches()) {
            throw new DataIntegrityException("Non-numeric " + kind.providerCode() + " sample '" + token
                    + "' at " + timestamp);
        }
        double value = Double.parseDouble(token);
        if (!Double.isFinite(value)) {
            throw new DataIntegrityException("Out of range " + kind.providerCode() + " sample '" + token
                    + "' at " + timestamp);
        }
        return value;
    }
}
