package com.climapipeline.service.config;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public final class OutputPaths {
    private static final String EXTENSION = ".csv";
    private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private OutputPaths() {
    }

    public static Path resolve(PipelineConfig.Output output, Clock clock) {
        String filename = output.filename();
        if (!filename.endsWith(EXTENSION)) {
            filename = filename + EXTENSION;
        }
        if (output.includeTimestamp()) {
            String stem = filename.substring(0, filename.length() - EXTENSION.length());
            filename = stem + "_" + LocalDateTime.now(clock).format(SUFFIX) + EXTENSION;
        }
        return Path.of(output.directory()).resolve(filename);
    }
}
