package com.climapipeline.core.events;

import java.time.Instant;

public record PipelineRunCompleted(
        Instant timestamp,
        String location,
        boolean success,
        int recordCount,
        String errorKind,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "PipelineRunCompleted";
    }
}
