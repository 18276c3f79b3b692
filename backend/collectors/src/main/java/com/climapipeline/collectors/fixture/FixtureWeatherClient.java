package com.climapipeline.collectors.fixture;

import com.climapipeline.collectors.api.WeatherClient;
import com.climapipeline.collectors.openmeteo.OpenMeteoResponseParser;
import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

public class FixtureWeatherClient implements WeatherClient {
    private final Path jsonFile;
    private final String body;
    private final OpenMeteoResponseParser parser = new OpenMeteoResponseParser();

    public FixtureWeatherClient(Path jsonFile) {
        this.jsonFile = jsonFile;
        try {
            this.body = Files.readString(jsonFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading weather fixture: " + jsonFile, e);
        }
    }

    @Override
    public RawWeatherResponse fetch(LocationConfig location, DateRange range, Set<VariableKind> variables) {
        if (location == null) {
            throw new ValidationException("Location is required");
        }
        if (variables == null || variables.isEmpty()) {
            throw new ValidationException("At least one weather variable must be requested");
        }
        return parser.parse(body, location, EnumSet.copyOf(variables));
    }

    public Path jsonFile() {
        return jsonFile;
    }
}
