package com.climapipeline.collectors.api;

import com.climapipeline.core.model.DateRange;
import com.climapipeline.core.model.LocationConfig;
import com.climapipeline.core.model.RawWeatherResponse;
import com.climapipeline.core.model.VariableKind;

import java.util.Set;

/**
 * Source of hourly weather data. One call is one attempt: implementations never retry, and every
 * failure surfaces as a {@link com.climapipeline.core.error.PipelineException} subtype.
 */
@FunctionalInterface
public interface WeatherClient {
    /**
     * @param range    dates to cover; {@code null} means today in the location's timezone
     * @param variables non-empty set of variables to request
     */
    RawWeatherResponse fetch(LocationConfig location, DateRange range, Set<VariableKind> variables);
}
