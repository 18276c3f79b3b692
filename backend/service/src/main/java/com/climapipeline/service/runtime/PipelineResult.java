package com.climapipeline.service.runtime;

import com.climapipeline.core.error.ErrorKind;
import com.climapipeline.core.model.DatasetSummary;

public record PipelineResult(
        boolean success,
        int recordCount,
        DatasetSummary summary,
        ErrorKind errorKind,
        String message,
        int attempts
) {
    public static PipelineResult success(int recordCount, DatasetSummary summary, int attempts) {
        return new PipelineResult(true, recordCount, summary, null, "Pipeline run completed", attempts);
    }

    public static PipelineResult failure(ErrorKind errorKind, String message, int attempts) {
        return new PipelineResult(false, 0, null, errorKind, message, attempts);
    }
}
