package com.climapipeline.core.model;

import com.climapipeline.core.error.DataIntegrityException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public final class WeatherDataset implements Iterable<WeatherRecord> {
    private static final WeatherDataset EMPTY = new WeatherDataset(List.of());

    private final List<WeatherRecord> records;

    private WeatherDataset(List<WeatherRecord> records) {
        this.records = records;
    }

    public static WeatherDataset empty() {
        return EMPTY;
    }

    public static WeatherDataset of(List<WeatherRecord> records) {
        Instant previous = null;
        int index = 0;
        for (WeatherRecord record : records) {
            Instant current = record.instant();
            if (previous != null && !current.isAfter(previous)) {
                throw new DataIntegrityException("Row " + index + " at " + record.timestamp()
                        + " is not strictly after the previous row");
            }
            previous = current;
            index++;
        }
        return records.isEmpty() ? EMPTY : new WeatherDataset(List.copyOf(records));
    }

    // Keeps the last occurrence of a duplicate instant.
    public static WeatherDataset normalize(Collection<WeatherRecord> records) {
        Map<Instant, WeatherRecord> byInstant = new LinkedHashMap<>();
        for (WeatherRecord record : records) {
            byInstant.remove(record.instant());
            byInstant.put(record.instant(), record);
        }
        List<WeatherRecord> sorted = new ArrayList<>(byInstant.values());
        sorted.sort(Comparator.comparing(WeatherRecord::instant));
        return of(sorted);
    }

    public WeatherDataset merge(WeatherDataset newer) {
        List<WeatherRecord> combined = new ArrayList<>(records.size() + newer.size());
        combined.addAll(records);
        combined.addAll(newer.records);
        return normalize(combined);
    }

    public List<WeatherRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public DatasetSummary summarize() {
        if (records.isEmpty()) {
            return new DatasetSummary(0, null, null, null, null, null, null);
        }
        return new DatasetSummary(
                records.size(),
                records.get(0).timestamp(),
                records.get(records.size() - 1).timestamp(),
                mean(WeatherRecord::temperatureC),
                mean(WeatherRecord::humidityPct),
                sum(WeatherRecord::precipitationMm),
                mean(WeatherRecord::windSpeedKmh)
        );
    }

    private Double mean(Function<WeatherRecord, Double> field) {
        double total = 0;
        int count = 0;
        for (WeatherRecord record : records) {
            Double value = field.apply(record);
            if (value != null) {
                total += value;
                count++;
            }
        }
        return count == 0 ? null : total / count;
    }

    private Double sum(Function<WeatherRecord, Double> field) {
        double total = 0;
        boolean any = false;
        for (WeatherRecord record : records) {
            Double value = field.apply(record);
            if (value != null) {
                total += value;
                any = true;
            }
        }
        return any ? total : null;
    }

    @Override
    public Iterator<WeatherRecord> iterator() {
        return records.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeatherDataset other)) {
            return false;
        }
        return records.equals(other.records);
    }

    @Override
    public int hashCode() {
        return records.hashCode();
    }

    @Override
    public String toString() {
        return "WeatherDataset" + records;
    }
}
