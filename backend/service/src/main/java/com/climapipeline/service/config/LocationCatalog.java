package com.climapipeline.service.config;

import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.LocationConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public record LocationCatalog(
        @JsonProperty("default") String defaultName,
        List<LocationConfig> locations
) {
    public LocationCatalog {
        locations = locations == null ? List.of() : List.copyOf(locations);
        if (locations.isEmpty()) {
            throw new ValidationException("Location catalog has no locations");
        }
        if (defaultName == null || defaultName.isBlank()) {
            defaultName = locations.get(0).name();
        }
        String wanted = defaultName;
        if (locations.stream().noneMatch(location -> location.name().equalsIgnoreCase(wanted))) {
            throw new ValidationException("Default location '" + defaultName + "' is not in the catalog");
        }
    }

    public static LocationCatalog builtIn() {
        return new LocationCatalog("Medellín", List.of(
                new LocationConfig("Medellín", 6.244, -75.581, "America/Bogota"),
                new LocationConfig("Bogotá", 4.711, -74.072, "America/Bogota"),
                new LocationConfig("Barranquilla", 10.964, -74.796, "America/Bogota"),
                new LocationConfig("Cali", 3.452, -76.532, "America/Bogota"),
                new LocationConfig("Bucaramanga", 7.125, -73.126, "America/Bogota"),
                new LocationConfig("Pasto", 1.214, -77.281, "America/Bogota"),
                new LocationConfig("Sincelejo", 9.304, -75.144, "America/Bogota"),
                new LocationConfig("Montería", 8.766, -75.847, "America/Bogota"),
                new LocationConfig("Villavicencio", 4.134, -73.635, "America/Bogota"),
                new LocationConfig("Envigado", 6.253, -75.564, "America/Bogota")
        ));
    }

    public LocationConfig defaultLocation() {
        return find(defaultName).orElseThrow();
    }

    public Optional<LocationConfig> find(String name) {
        return locations.stream()
                .filter(location -> location.name().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    public List<LocationConfig> search(String query, int limit) {
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<LocationConfig> matches = new ArrayList<>();
        for (LocationConfig location : locations) {
            if (matches.size() >= limit) {
                break;
            }
            if (needle.isEmpty() || location.name().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(location);
            }
        }
        return matches;
    }
}
