package com.climapipeline.core.model;

import com.climapipeline.core.error.UnsupportedVariableException;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum VariableKind {
    // Declaration order is the CSV column order and the order of the hourly request parameter.
    TEMPERATURE("temperature", "temperature_2m", "temperature_c", "°C"),
    HUMIDITY("humidity", "relative_humidity_2m", "humidity_pct", "%"),
    PRECIPITATION("precipitation", "precipitation", "precipitation_mm", "mm"),
    WIND_SPEED("wind_speed", "wind_speed_10m", "wind_speed_kmh", "km/h");

    private final String shortName;
    private final String providerCode;
    private final String column;
    private final String unit;

    VariableKind(String shortName, String providerCode, String column, String unit) {
        this.shortName = shortName;
        this.providerCode = providerCode;
        this.column = column;
        this.unit = unit;
    }

    public String shortName() {
        return shortName;
    }

    public String providerCode() {
        return providerCode;
    }

    public String column() {
        return column;
    }

    public String unit() {
        return unit;
    }

    public static Optional<VariableKind> fromProviderCode(String code) {
        for (VariableKind kind : values()) {
            if (kind.providerCode.equals(code)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static VariableKind parse(String name) {
        if (name != null) {
            String key = name.trim().toLowerCase(Locale.ROOT);
            for (VariableKind kind : values()) {
                if (kind.shortName.equals(key) || kind.providerCode.equals(key) || kind.column.equals(key)) {
                    return kind;
                }
            }
        }
        throw new UnsupportedVariableException("Unsupported weather variable: " + name);
    }

    public static Set<VariableKind> parseAll(Collection<String> names) {
        Set<VariableKind> kinds = EnumSet.noneOf(VariableKind.class);
        for (String name : names) {
            kinds.add(parse(name));
        }
        return kinds;
    }
}
