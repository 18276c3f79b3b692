package com.climapipeline.service.runtime;

import com.climapipeline.core.error.ErrorKind;
import com.climapipeline.core.error.HttpStatusException;
import com.climapipeline.core.error.PipelineException;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration backoff) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must be zero or positive");
        }
    }

    public static RetryPolicy singleAttempt() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    public boolean shouldRetry(PipelineException failure, int attempt) {
        if (attempt >= maxAttempts) {
            return false;
        }
        if (failure.kind() == ErrorKind.NETWORK) {
            return true;
        }
        return failure instanceof HttpStatusException status && status.isServerError();
    }
}
