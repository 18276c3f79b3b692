package com.climapipeline.service.runtime;

import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WriteMode;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record PipelineRequest(
        LocationConfig location,
        DateRange dateRange,
        Set<VariableKind> variables,
        Path outputPath,
        WriteMode mode
) {
    public PipelineRequest {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(variables, "variables are required");
        Objects.requireNonNull(outputPath, "outputPath is required");
        Objects.requireNonNull(mode, "mode is required");
        variables = variables.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(variables));
    }
}
