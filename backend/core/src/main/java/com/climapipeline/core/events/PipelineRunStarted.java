package com.climapipeline.core.events;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record PipelineRunStarted(
        Instant timestamp,
        String location,
        LocalDate startDate,
        LocalDate endDate,
        List<String> variables,
        int attempt
) implements Event {
    @Override
    public String type() {
        return "PipelineRunStarted";
    }
}
