package com.climapipeline.service.store;

import com.climapipeline.core.error.CorruptFileException;
import com.climapipeline.core.error.DataIntegrityException;
import com.climapipeline.core.model.VariableKind;
import com.climapipeline.core.model.WeatherDataset;
import com.climapipeline.core.model.WeatherRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * On-disk table format read by the dashboard:
 * <ul>
 *     <li>UTF-8, {@code \n} line endings, a header row, comma separated;</li>
 *     <li>columns {@code timestamp,temperature_c,humidity_pct,precipitation_mm,wind_speed_kmh};</li>
 *     <li>timestamps as ISO-8601 with offset, e.g. {@code 2024-01-01T00:00:00-05:00};</li>
 *     <li>numbers in plain notation, the shortest digits that read back to the same double, with at
 *     least one fractional digit ({@code 10.0}, {@code 0.00001});</li>
 *     <li>a missing value is an empty field.</li>
 * </ul>
 */
public final class WeatherCsvCodec {
    public static final List<String> COLUMNS = columns();

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final Pattern NUMBER = Pattern.compile("-?(0|[1-9]\\d*)(\\.\\d+)?([eE][+-]?\\d+)?");
    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    private static final CsvSchema SCHEMA = CsvSchema.emptySchema()
            .withColumnSeparator(',')
            .withLineSeparator("\n");

    public byte[] encode(WeatherDataset dataset) {
        StringWriter out = new StringWriter();
        try (SequenceWriter rows = CSV.writerFor(String[].class).with(SCHEMA).writeValues(out)) {
            rows.write(COLUMNS.toArray(new String[0]));
            for (WeatherRecord record : dataset) {
                rows.write(toRow(record));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to render weather table", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    public WeatherDataset decode(byte[] content, Path source) {
        List<String[]> rows;
        try (MappingIterator<String[]> it = CSV.readerFor(String[].class).with(SCHEMA).readValues(content)) {
            rows = it.readAll();
        } catch (IOException e) {
            throw new CorruptFileException("Unreadable table in " + source + ": " + e.getMessage(), e);
        }
        if (rows.isEmpty()) {
            throw new CorruptFileException("Table in " + source + " has no header row");
        }
        List<String> header = Arrays.asList(rows.get(0));
        if (!COLUMNS.equals(header)) {
            throw new CorruptFileException("Table in " + source + " has columns " + header + ", expected " + COLUMNS);
        }
        List<WeatherRecord> records = new ArrayList<>(rows.size() - 1);
        for (int i = 1; i < rows.size(); i++) {
            records.add(fromRow(rows.get(i), i + 1, source));
        }
        try {
            return WeatherDataset.of(records);
        } catch (DataIntegrityException e) {
            throw new CorruptFileException("Table in " + source + " is not in strict timestamp order: " + e.getMessage(), e);
        }
    }

    static String formatNumber(Double value) {
        if (value == null) {
            return "";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 1) {
            decimal = decimal.setScale(1);
        }
        return decimal.toPlainString();
    }

    private static String[] toRow(WeatherRecord record) {
        String[] row = new String[COLUMNS.size()];
        row[0] = TIMESTAMP.format(record.timestamp());
        VariableKind[] kinds = VariableKind.values();
        for (int i = 0; i < kinds.length; i++) {
            row[i + 1] = formatNumber(record.value(kinds[i]));
        }
        return row;
    }

    private static WeatherRecord fromRow(String[] row, int line, Path source) {
        if (row.length != COLUMNS.size()) {
            throw new CorruptFileException("Line " + line + " of " + source + " has " + row.length
                    + " fields, expected " + COLUMNS.size());
        }
        OffsetDateTime timestamp;
        try {
            timestamp = OffsetDateTime.parse(row[0], TIMESTAMP);
        } catch (DateTimeParseException e) {
            throw new CorruptFileException("Line " + line + " of " + source + " has an invalid timestamp '" + row[0] + "'", e);
        }
        Double[] values = new Double[COLUMNS.size() - 1];
        for (int i = 1; i < row.length; i++) {
            values[i - 1] = parseNumber(row[i], COLUMNS.get(i), line, source);
        }
        return new WeatherRecord(timestamp, values[0], values[1], values[2], values[3]);
    }

    private static Double parseNumber(String text, String column, int line, Path source) {
        if (text.isEmpty()) {
            return null;
        }
        if (!NUMBER.matcher(text).matches()) {
            throw new CorruptFileException("Line " + line + " of " + source + " has non-numeric " + column + " '" + text + "'");
        }
        return Double.parseDouble(text);
    }

    private static List<String> columns() {
        List<String> columns = new ArrayList<>();
        columns.add("timestamp");
        for (VariableKind kind : VariableKind.values()) {
            columns.add(kind.column());
        }
        return List.copyOf(columns);
    }
}
