package com.climapipeline.core.model;

import com.climapipeline.core.error.MalformedResponseException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Provider payload as received. Samples are raw tokens, with JSON {@code null} kept as {@code null}.
 * The time axis is kept in provider order: it is expected ascending and unique, but that is not
 * checked here. {@code WeatherTransformer} sorts by instant and keeps the last duplicate.
 */
public record RawWeatherResponse(
        LocationConfig location,
        Set<VariableKind> requested,
        List<String> time,
        Map<VariableKind, List<String>> samples,
        Map<VariableKind, String> units,
        Set<String> unrecognizedKeys
) {
    public RawWeatherResponse {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(time, "time is required");
        requested = Set.copyOf(requested);
        Map<VariableKind, List<String>> copied = new EnumMap<>(VariableKind.class);
        for (Map.Entry<VariableKind, List<String>> entry : samples.entrySet()) {
            if (entry.getValue().size() != time.size()) {
                throw new MalformedResponseException("Variable " + entry.getKey().providerCode() + " has "
                        + entry.getValue().size() + " samples for " + time.size() + " timestamps");
            }
            copied.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        time = List.copyOf(time);
        samples = Collections.unmodifiableMap(copied);
        Map<VariableKind, String> copiedUnits = new EnumMap<>(VariableKind.class);
        if (units != null) {
            copiedUnits.putAll(units);
        }
        units = Collections.unmodifiableMap(copiedUnits);
        unrecognizedKeys = unrecognizedKeys == null ? Set.of() : Set.copyOf(unrecognizedKeys);
    }

    public int hours() {
        return time.size();
    }
}
