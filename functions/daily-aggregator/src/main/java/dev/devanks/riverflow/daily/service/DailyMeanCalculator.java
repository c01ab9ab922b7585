package dev.devanks.riverflow.daily.service;

import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.entity.HourlyReadingEntity;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.RawReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;

import static java.time.ZoneOffset.UTC;
import static java.util.stream.Collectors.groupingBy;
import static java.util.stream.Collectors.toList;

@Component
@Slf4j
public class DailyMeanCalculator {

    /**
     * Turns the hourly map of a realtime snapshot back into readings. Entries whose timestamp
     * cannot be parsed are dropped.
     */
    public List<RawReading> toReadings(CurrentStationEntity snapshot) {
        List<RawReading> readings = new ArrayList<>();
        if (snapshot.getHourlyReadings() == null) {
            return readings;
        }
        snapshot.getHourlyReadings().forEach((key, hourly) -> {
            Instant timestamp = parseTimestamp(key, hourly);
            if (timestamp == null) {
                log.debug("Dropping hourly reading with unparseable timestamp '{}' for {}", key, snapshot.getId());
                return;
            }
            readings.add(RawReading.builder()
                    .timestamp(timestamp)
                    .level(hourly != null ? hourly.getLevel() : null)
                    .discharge(hourly != null ? hourly.getDischarge() : null)
                    .build());
        });
        return readings;
    }

    /**
     * One mean per UTC calendar day, ascending by date. A day whose readings all lack a measure
     * still gets a record, with that mean left null.
     */
    public List<DailyMean> computeDailyMeans(Collection<RawReading> readings) {
        Map<LocalDate, List<RawReading>> byDate = readings.stream()
                .collect(groupingBy(reading -> reading.getTimestamp().atZone(UTC).toLocalDate(), TreeMap::new, toList()));

        List<DailyMean> means = new ArrayList<>(byDate.size());
        byDate.forEach((date, dayReadings) -> means.add(DailyMean.builder()
                .date(date)
                .meanLevel(mean(dayReadings, RawReading::getLevel))
                .meanDischarge(mean(dayReadings, RawReading::getDischarge))
                .readingCount(dayReadings.size())
                .build()));
        return means;
    }

    /**
     * Partitions means by calendar year, years ascending.
     */
    public Map<Integer, List<DailyMean>> byYear(Collection<DailyMean> means) {
        return means.stream().collect(groupingBy(DailyMean::getYear, TreeMap::new, toList()));
    }

    private static Double mean(List<RawReading> readings, Function<RawReading, Double> measure) {
        OptionalDouble average = readings.stream()
                .map(measure)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return average.isPresent() ? average.getAsDouble() : null;
    }

    private static Instant parseTimestamp(String key, HourlyReadingEntity hourly) {
        Instant parsed = tryParse(key);
        if (parsed == null && hourly != null) {
            parsed = tryParse(hourly.getDatetime());
        }
        return parsed;
    }

    private static Instant tryParse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value).toInstant(); // e.g. 2024-05-01T10:00:00+00:00
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
