package com.climapipeline.core.model;

import java.time.OffsetDateTime;

public record DatasetSummary(
        int rows,
        OffsetDateTime first,
        OffsetDateTime last,
        Double meanTemperatureC,
        Double meanHumidityPct,
        Double totalPrecipitationMm,
        Double meanWindSpeedKmh
) {
}
