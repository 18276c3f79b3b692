package com.climapipeline.core.model;

import com.climapipeline.core.error.DataIntegrityException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeatherDatasetTest {
    private static final OffsetDateTime T1 = OffsetDateTime.parse("2024-05-01T01:00-05:00");
    private static final OffsetDateTime T2 = OffsetDateTime.parse("2024-05-01T02:00-05:00");
    private static final OffsetDateTime T3 = OffsetDateTime.parse("2024-05-01T03:00-05:00");

    @Test
    void ofRequiresStrictlyAscendingRows() {
        assertThrows(DataIntegrityException.class, () -> WeatherDataset.of(List.of(row(T2, 1.0), row(T1, 2.0))));
        assertThrows(DataIntegrityException.class, () -> WeatherDataset.of(List.of(row(T1, 1.0), row(T1, 2.0))));
    }

    @Test
    void sameInstantInAnotherOffsetIsADuplicate() {
        OffsetDateTime t1Utc = OffsetDateTime.parse("2024-05-01T06:00Z");
        assertThrows(DataIntegrityException.class, () -> WeatherDataset.of(List.of(row(T1, 1.0), row(t1Utc, 2.0))));
    }

    @Test
    void normalizeSortsAndKeepsLastDuplicate() {
        WeatherDataset dataset = WeatherDataset.normalize(List.of(row(T3, 3.0), row(T1, 1.0), row(T3, 30.0)));

        assertEquals(List.of(row(T1, 1.0), row(T3, 30.0)), dataset.records());
    }

    @Test
    void mergeLetsNewerRowsWinAndKeepsOrder() {
        WeatherDataset existing = WeatherDataset.of(List.of(row(T1, 10.0), row(T2, 20.0)));
        WeatherDataset incoming = WeatherDataset.of(List.of(row(T2, 22.0), row(T3, 30.0)));

        WeatherDataset merged = existing.merge(incoming);

        assertEquals(List.of(row(T1, 10.0), row(T2, 22.0), row(T3, 30.0)), merged.records());
        assertEquals(merged, merged.merge(WeatherDataset.empty()));
    }

    @Test
    void emptyDatasetIsShared() {
        assertSame(WeatherDataset.empty(), WeatherDataset.of(List.of()));
        assertTrue(WeatherDataset.empty().isEmpty());
        assertEquals(0, WeatherDataset.empty().summarize().rows());
    }

    @Test
    void summaryIgnoresNullSamples() {
        WeatherDataset dataset = WeatherDataset.of(List.of(
                new WeatherRecord(T1, 10.0, 80.0, 0.5, null),
                new WeatherRecord(T2, null, 90.0, 1.5, null),
                new WeatherRecord(T3, 20.0, null, null, null)
        ));

        DatasetSummary summary = dataset.summarize();

        assertEquals(3, summary.rows());
        assertEquals(T1, summary.first());
        assertEquals(T3, summary.last());
        assertEquals(15.0, summary.meanTemperatureC());
        assertEquals(85.0, summary.meanHumidityPct());
        assertEquals(2.0, summary.totalPrecipitationMm());
        assertNull(summary.meanWindSpeedKmh());
    }

    @Test
    void recordsAreUnmodifiable() {
        WeatherDataset dataset = WeatherDataset.of(List.of(row(T1, 1.0)));
        assertThrows(UnsupportedOperationException.class, () -> dataset.records().add(row(T2, 2.0)));
    }

    private static WeatherRecord row(OffsetDateTime timestamp, double temperature) {
        return new WeatherRecord(timestamp, temperature, null, null, null);
    }
}
