package com.climapipeline.core.events;

import java.time.Instant;

public record DatasetSaved(
        Instant timestamp,
        String path,
        String mode,
        int incomingRows,
        int totalRows
) implements Event {
    @Override
    public String type() {
        return "DatasetSaved";
    }
}
