package com.climapipeline.service.cache;

import com.climapipeline.collectors.api.WeatherClient;
import com.climapipeline.core.error.ValidationException;
import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;

import java.time.Clock;
import java.util.Optional;
import java.util.Set;

public final class CachingWeatherClient implements WeatherClient {
    private final WeatherClient delegate;
    private final ResponseCache cache;
    private final Clock clock;

    public CachingWeatherClient(WeatherClient delegate, ResponseCache cache, Clock clock) {
        this.delegate = delegate;
        this.cache = cache;
        this.clock = clock;
    }

    @Override
    public RawWeatherResponse fetch(LocationConfig location, DateRange range, Set<VariableKind> variables) {
        if (location == null) {
            throw new ValidationException("Location is required");
        }
        if (variables == null || variables.isEmpty()) {
            throw new ValidationException("At least one weather variable must be requested");
        }
        DateRange effective = range == null ? DateRange.today(location.zoneId(), clock) : range;
        String key = ResponseCache.keyFor(location, effective, variables);
        Optional<RawWeatherResponse> cached = cache.get(key);
        if (cached.isPresent() && cached.get().location().equals(location)) {
            return cached.get();
        }
        RawWeatherResponse fresh = delegate.fetch(location, effective, variables);
        cache.put(key, fresh);
        return fresh;
    }
}
