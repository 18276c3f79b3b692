package com.climapipeline.collectors.openmeteo;

import com.climapipeline.core.error.MalformedResponseException;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class OpenMeteoResponseParser {
    static final String HOURLY = "hourly";
    static final String HOURLY_UNITS = "hourly_units";
    static final String TIME = "time";

    public RawWeatherResponse parse(String body, LocationConfig location, Set<VariableKind> requested) {
        JsonNode root = readTree(body);
        JsonNode hourly = root.get(HOURLY);
        if (hourly == null || !hourly.isObject()) {
            throw new MalformedResponseException("Response has no '" + HOURLY + "' block");
        }
        JsonNode timeNode = hourly.get(TIME);
        if (timeNode == null || !timeNode.isArray()) {
            throw new MalformedResponseException("Response has no hourly '" + TIME + "' axis");
        }
        List<String> time = new ArrayList<>(timeNode.size());
        for (JsonNode stamp : timeNode) {
            if (!stamp.isTextual()) {
                throw new MalformedResponseException("Hourly time entry is not a string: " + stamp);
            }
            time.add(stamp.asText());
        }

        Map<VariableKind, List<String>> samples = new EnumMap<>(VariableKind.class);
        Set<String> unrecognized = new LinkedHashSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = hourly.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (TIME.equals(field.getKey())) {
                continue;
            }
            Optional<VariableKind> kind = VariableKind.fromProviderCode(field.getKey());
            if (kind.isEmpty()) {
                unrecognized.add(field.getKey());
                continue;
            }
            if (!requested.contains(kind.get())) {
                continue;
            }
            samples.put(kind.get(), tokens(field.getKey(), field.getValue(), time.size()));
        }

        Map<VariableKind, String> units = new EnumMap<>(VariableKind.class);
        JsonNode unitsNode = root.path(HOURLY_UNITS);
        for (VariableKind kind : requested) {
            JsonNode unit = unitsNode.get(kind.providerCode());
            if (unit != null && unit.isTextual()) {
                units.put(kind, unit.asText());
            }
        }
        return new RawWeatherResponse(location, requested, time, samples, units, unrecognized);
    }

    private static JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new MalformedResponseException("Response body is empty");
        }
        JsonNode root;
        try {
            root = JsonUtils.objectMapper().readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedResponseException("Response body is not a JSON object");
        }
        return root;
    }

    private static List<String> tokens(String code, JsonNode values, int expected) {
        if (!values.isArray()) {
            throw new MalformedResponseException("Hourly '" + code + "' is not an array");
        }
        if (values.size() != expected) {
            throw new MalformedResponseException("Hourly '" + code + "' has " + values.size()
                    + " samples but the time axis has " + expected);
        }
        List<String> tokens = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            if (value.isNull()) {
                tokens.add(null);
            } else if (value.isNumber()) {
                tokens.add(value.asText());
            } else {
                // JSON text, so a quoted "12.5" stays quoted and is rejected as non-numeric
                tokens.add(value.toString());
            }
        }
        return tokens;
    }
}
