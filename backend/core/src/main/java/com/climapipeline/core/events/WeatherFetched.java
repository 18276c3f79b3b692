package com.climapipeline.core.events;

import java.time.Instant;

public record WeatherFetched(
        Instant timestamp,
        String location,
        int hours
) implements Event {
    @Override
    public String type() {
        return "WeatherFetched";
    }
}
