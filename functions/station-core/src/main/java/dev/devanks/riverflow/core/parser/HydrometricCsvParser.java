package dev.devanks.riverflow.core.parser;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.RawReading;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static java.time.ZoneOffset.UTC;

/**
 * Parses hydrometric CSV bodies into readings.
 * <p>
 * Columns are located by header name, so both the OGC API output ({@code DATETIME, LEVEL, DISCHARGE})
 * and the datamart files ({@code Date, Water Level / Niveau d'eau (m), Discharge / Débit (cms)}) are
 * understood regardless of column order. Rows are parsed defensively:
 * <ul>
 *     <li>a row whose timestamp cannot be parsed is dropped;</li>
 *     <li>a missing or unparseable measurement becomes {@code null}, the row is kept;</li>
 *     <li>a structurally broken tail ends parsing, rows read so far are returned.</li>
 * </ul>
 */
@Component
@Slf4j
public class HydrometricCsvParser {

    private static final List<String> TIMESTAMP_COLUMNS = List.of("DATETIME", "Date");
    private static final List<String> DATE_COLUMNS = List.of("DATE", "Date");
    private static final List<String> LEVEL_COLUMNS = List.of("LEVEL", "Water Level");
    private static final List<String> DISCHARGE_COLUMNS = List.of("DISCHARGE", "Discharge");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    public List<RawReading> parseReadings(String csv, String stationKey) {
        return parse(csv, stationKey, TIMESTAMP_COLUMNS, (record, columns) ->
                parseInstant(valueAt(record, columns.getTime()))
                        .map(timestamp -> RawReading.builder()
                                .timestamp(timestamp)
                                .level(parseDouble(valueAt(record, columns.getLevel())))
                                .discharge(parseDouble(valueAt(record, columns.getDischarge())))
                                .build()));
    }

    public List<DailyMean> parseDailyMeans(String csv, String stationKey) {
        return parse(csv, stationKey, DATE_COLUMNS, (record, columns) ->
                parseDate(valueAt(record, columns.getTime()))
                        .map(date -> DailyMean.builder()
                                .date(date)
                                .meanLevel(parseDouble(valueAt(record, columns.getLevel())))
                                .meanDischarge(parseDouble(valueAt(record, columns.getDischarge())))
                                .build()));
    }

    private <T> List<T> parse(String csv, String stationKey, List<String> timeColumns, RowMapper<T> mapper) {
        if (csv == null || csv.isBlank()) {
            log.debug("Empty CSV body for station {}.", stationKey);
            return List.of();
        }

        List<T> rows = new ArrayList<>();
        int dropped = 0;
        try (CSVParser parser = CSVParser.parse(stripBom(csv), FORMAT)) {
            List<String> headers = parser.getHeaderNames();
            var columns = new Columns(
                    resolveColumn(headers, timeColumns),
                    resolveColumn(headers, LEVEL_COLUMNS),
                    resolveColumn(headers, DISCHARGE_COLUMNS));
            if (columns.getTime() < 0) {
                log.warn("CSV for station {} has no timestamp column (headers: {}); no rows parsed.", stationKey, headers);
                return List.of();
            }

            for (CSVRecord record : parser) {
                Optional<T> row = mapper.map(record, columns);
                if (row.isPresent()) {
                    rows.add(row.get());
                } else {
                    dropped++;
                    log.debug("Dropped row {} for station {}: unparseable timestamp.", record.getRecordNumber(), stationKey);
                }
            }
        } catch (IOException | UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            log.warn("CSV for station {} is malformed after {} rows; keeping parsed rows. Cause: {}",
                    stationKey, rows.size(), e.getMessage());
        }

        if (dropped > 0) {
            log.info("Parsed {} rows for station {} ({} dropped).", rows.size(), stationKey, dropped);
        }
        return rows;
    }

    @VisibleForTesting
    static int resolveColumn(List<String> headers, List<String> candidates) {
        for (String candidate : candidates) {
            for (int i = 0; i < headers.size(); i++) {
                if (candidate.equalsIgnoreCase(headers.get(i))) {
                    return i;
                }
            }
        }
        // Datamart headers are bilingual, e.g. "Water Level / Niveau d'eau (m)"
        for (String candidate : candidates) {
            String prefix = candidate.toLowerCase(Locale.ROOT);
            for (int i = 0; i < headers.size(); i++) {
                if (headers.get(i) != null && headers.get(i).toLowerCase(Locale.ROOT).startsWith(prefix + " ")) {
                    return i;
                }
            }
        }
        return -1;
    }

    @VisibleForTesting
    static Optional<Instant> parseInstant(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            try {
                // No offset: the provider reports UTC
                return Optional.of(LocalDateTime.parse(value).toInstant(UTC));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    @VisibleForTesting
    static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            return parseInstant(value).map(instant -> instant.atZone(UTC).toLocalDate());
        }
    }

    @VisibleForTesting
    static Double parseDouble(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String valueAt(CSVRecord record, int index) {
        if (index < 0 || index >= record.size()) {
            return null;
        }
        return record.get(index);
    }

    private static String stripBom(String csv) {
        return csv.charAt(0) == '\uFEFF' ? csv.substring(1) : csv;
    }

    @Value
    private static class Columns {
        int time;
        int level;
        int discharge;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        Optional<T> map(CSVRecord record, Columns columns);
    }
}
