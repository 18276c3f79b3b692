package com.climapipeline.service.config;

import com.climapipeline.core.error.PipelineException;
import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.util.JsonUtils;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static PipelineConfig loadPipeline(Path configDir) {
        Path file = configDir.resolve("pipeline.json");
        if (!Files.exists(file)) {
            LOGGER.info(() -> "No " + file + " found; using built-in defaults");
            return PipelineConfig.defaults();
        }
        PipelineConfig config = read(file, new TypeReference<>() {
        });
        if (config == null) {
            throw new ValidationException("Config file " + file + " is empty");
        }
        try {
            config.variableKinds();
        } catch (PipelineException e) {
            throw withFile(file, e);
        }
        return config;
    }

    public static LocationCatalog loadLocations(Path configDir) {
        Path file = configDir.resolve("locations.json");
        if (!Files.exists(file)) {
            return LocationCatalog.builtIn();
        }
        LocationCatalog catalog = read(file, new TypeReference<>() {
        });
        if (catalog == null) {
            throw new ValidationException("Config file " + file + " is empty");
        }
        return catalog;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            PipelineException rejected = findPipelineCause(e);
            if (rejected != null) {
                throw withFile(path, rejected);
            }
            throw new ValidationException("Failed loading config from " + path + ": " + e.getMessage(), e);
        }
    }

    private static PipelineException findPipelineCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof PipelineException rejected) {
                return rejected;
            }
            current = current.getCause();
        }
        return null;
    }

    private static PipelineException withFile(Path path, PipelineException rejected) {
        if (rejected instanceof ValidationException) {
            return new ValidationException("Invalid config in " + path + ": " + rejected.getMessage(), rejected);
        }
        return rejected;
    }
}
