package com.climapipeline.service.config;

import com.climapipeline.core.error.UnsupportedVariableException;
import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WriteMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ConfigLoaderTest {
    @TempDir
    Path configDir;

    @Test
    void missingPipelineFileFallsBackToDefaults() {
        PipelineConfig config = ConfigLoader.loadPipeline(configDir);

        assertEquals("Medellín", config.location().name());
        assertEquals(EnumSet.allOf(VariableKind.class), config.variableKinds());
        assertEquals("data", config.output().directory());
        assertEquals("weather_data.csv", config.output().filename());
        assertEquals(WriteMode.OVERWRITE, config.output().mode());
        assertEquals("https://api.open-meteo.com", config.http().baseUrl());
        assertEquals(Duration.ofSeconds(10), config.http().requestTimeout());
        assertTrue(config.cache().enabled());
        assertEquals(Duration.ofMinutes(15), config.cache().ttl());
        assertEquals(1, config.retry().maxAttempts());
        assertEquals("logs/events.jsonl", config.eventLog());
    }

    @Test
    void readsEverySectionAndKeepsDefaultsForTheRest() throws IOException {
        write("pipeline.json", "{"
                + "\"location\":{\"name\":\"Cali\",\"latitude\":3.452,\"longitude\":-76.532,\"timezone\":\"America/Bogota\"},"
                + "\"variables\":[\"temperature\",\"precipitation\"],"
                + "\"dates\":{\"startDate\":\"2024-05-01\",\"endDate\":\"2024-05-03\"},"
                + "\"output\":{\"directory\":\"out\",\"filename\":\"cali\",\"mode\":\"append\",\"includeTimestamp\":true},"
                + "\"http\":{\"requestTimeout\":\"PT3S\"},"
                + "\"retry\":{\"maxAttempts\":3,\"backoff\":\"PT0.5S\"},"
                + "\"unknownSection\":{}"
                + "}");

        PipelineConfig config = ConfigLoader.loadPipeline(configDir);

        assertEquals("Cali", config.location().name());
        assertEquals(EnumSet.of(VariableKind.TEMPERATURE, VariableKind.PRECIPITATION), config.variableKinds());
        assertEquals(LocalDate.of(2024, 5, 3), config.dates().endDate());
        assertNull(config.dates().forecastDays());
        assertEquals(WriteMode.APPEND, config.output().mode());
        assertTrue(config.output().includeTimestamp());
        assertEquals(Duration.ofSeconds(3), config.http().requestTimeout());
        assertEquals(Duration.ofSeconds(5), config.http().connectTimeout());
        assertEquals(3, config.retry().maxAttempts());
        assertEquals(Duration.ofMillis(500), config.retry().backoff());
    }

    @Test
    void outOfRangeCoordinatesNameTheFile() throws IOException {
        write("pipeline.json", "{\"location\":{\"name\":\"Bad\",\"latitude\":120,\"longitude\":0,\"timezone\":\"UTC\"}}");

        ValidationException error = assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));

        assertTrue(error.getMessage().contains("pipeline.json"));
        assertTrue(error.getMessage().contains("Latitude"));
    }

    @Test
    void missingCoordinatesAreRejectedNotZeroed() throws IOException {
        write("pipeline.json", "{\"location\":{\"name\":\"Nowhere\",\"timezone\":\"UTC\"}}");

        ValidationException error = assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));

        assertTrue(error.getMessage().contains("pipeline.json"));
        assertTrue(error.getMessage().contains("Latitude and longitude are required"));
    }

    @Test
    void nullCoordinateIsRejected() throws IOException {
        write("pipeline.json", "{\"location\":{\"name\":\"Nowhere\",\"latitude\":null,"
                + "\"longitude\":-75.5,\"timezone\":\"UTC\"}}");

        ValidationException error = assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));

        assertTrue(error.getMessage().contains("pipeline.json"));
    }

    @Test
    void locationsFileWithoutCoordinatesIsRejected() throws IOException {
        write("locations.json", "{\"locations\":[{\"name\":\"Cali\",\"timezone\":\"America/Bogota\"}]}");

        assertThrows(ValidationException.class, () -> ConfigLoader.loadLocations(configDir));
    }

    @Test
    void unknownVariableIsUnsupported() throws IOException {
        write("pipeline.json", "{\"variables\":[\"temperature\",\"pressure\"]}");

        assertThrows(UnsupportedVariableException.class, () -> ConfigLoader.loadPipeline(configDir));
    }

    @Test
    void emptyVariableListIsInvalid() throws IOException {
        write("pipeline.json", "{\"variables\":[]}");

        assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));
    }

    @Test
    void badModeAndConflictingDatesAreInvalid() throws IOException {
        write("pipeline.json", "{\"output\":{\"mode\":\"sideways\"}}");
        assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));

        write("pipeline.json", "{\"dates\":{\"startDate\":\"2024-05-01\",\"endDate\":\"2024-05-01\",\"forecastDays\":3}}");
        assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));
    }

    @Test
    void brokenJsonIsInvalid() throws IOException {
        write("pipeline.json", "{\"location\": ");

        ValidationException error = assertThrows(ValidationException.class, () -> ConfigLoader.loadPipeline(configDir));

        assertTrue(error.getMessage().startsWith("Failed loading config from"));
    }

    @Test
    void locationsFallBackToBuiltInCatalog() throws IOException {
        assertEquals("Medellín", ConfigLoader.loadLocations(configDir).defaultLocation().name());

        write("locations.json", "{\"default\":\"Pasto\",\"locations\":["
                + "{\"name\":\"Cali\",\"latitude\":3.452,\"longitude\":-76.532,\"timezone\":\"America/Bogota\"},"
                + "{\"name\":\"Pasto\",\"latitude\":1.214,\"longitude\":-77.281,\"timezone\":\"America/Bogota\"}]}");

        LocationCatalog catalog = ConfigLoader.loadLocations(configDir);
        assertEquals("Pasto", catalog.defaultLocation().name());
        assertEquals(2, catalog.locations().size());
        assertFalse(catalog.find("Medellín").isPresent());
    }

    @Test
    void shippedConfigFilesLoad() {
        Path shipped = Path.of("../../config");
        assumeTrue(Files.isDirectory(shipped));
        PipelineConfig config = ConfigLoader.loadPipeline(shipped);
        assertEquals(1, config.dates().forecastDays());
        assertEquals(10, ConfigLoader.loadLocations(shipped).locations().size());
    }

    private void write(String name, String json) throws IOException {
        Files.writeString(configDir.resolve(name), json, StandardCharsets.UTF_8);
    }
}
