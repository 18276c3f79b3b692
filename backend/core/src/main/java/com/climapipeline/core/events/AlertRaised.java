package com.climapipeline.core.events;

import com.climapipeline.core.error.ErrorKind;

import java.time.Instant;

public record AlertRaised(
        Instant timestamp,
        ErrorKind kind,
        String location,
        int attempts,
        String message
) implements Event {
    @Override
    public String type() {
        return "AlertRaised";
    }
}
