package dev.devanks.riverflow.daily.service;

import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.entity.HourlyReadingEntity;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.RawReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("DailyMeanCalculator Unit Tests")
class DailyMeanCalculatorTest {

    private final DailyMeanCalculator calculator = new DailyMeanCalculator();

    private static RawReading reading(String timestamp, Double level, Double discharge) {
        return RawReading.builder().timestamp(Instant.parse(timestamp)).level(level).discharge(discharge).build();
    }

    @Test
    @DisplayName("computeDailyMeans: groups by UTC date and averages non-null values")
    void computeDailyMeans_groupsByUtcDate() {
        List<RawReading> readings = List.of(
                reading("2024-05-01T00:00:00Z", 7.0, 40.0),
                reading("2024-05-01T12:00:00Z", 8.0, null),
                reading("2024-05-01T23:59:59Z", 9.0, 44.0),
                reading("2024-05-02T00:00:00Z", 6.5, 39.0));

        List<DailyMean> means = calculator.computeDailyMeans(readings);

        assertThat(means).extracting(DailyMean::getDate)
                .containsExactly(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2));

        DailyMean first = means.get(0);
        assertThat(first.getMeanLevel()).isCloseTo(8.0, within(1e-9));
        assertThat(first.getMeanDischarge()).isCloseTo(42.0, within(1e-9));
        assertThat(first.getReadingCount()).isEqualTo(3);

        DailyMean second = means.get(1);
        assertThat(second.getMeanLevel()).isEqualTo(6.5);
        assertThat(second.getReadingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("computeDailyMeans: a day without any level still produces a record with null mean")
    void computeDailyMeans_allNullMeasure_yieldsNullMean() {
        List<RawReading> readings = List.of(
                reading("2024-05-01T01:00:00Z", null, 40.0),
                reading("2024-05-01T02:00:00Z", null, 42.0));

        List<DailyMean> means = calculator.computeDailyMeans(readings);

        assertThat(means).singleElement().satisfies(mean -> {
            assertThat(mean.getMeanLevel()).isNull();
            assertThat(mean.getMeanDischarge()).isCloseTo(41.0, within(1e-9));
            assertThat(mean.getReadingCount()).isEqualTo(2);
        });
    }

    @Test
    @DisplayName("computeDailyMeans: means are not rounded")
    void computeDailyMeans_keepsFullPrecision() {
        List<RawReading> readings = List.of(
                reading("2024-05-01T01:00:00Z", 1.0, null),
                reading("2024-05-01T02:00:00Z", 1.0, null),
                reading("2024-05-01T03:00:00Z", 2.0, null));

        assertThat(calculator.computeDailyMeans(readings).get(0).getMeanLevel())
                .isCloseTo(4.0 / 3.0, within(1e-12));
    }

    @Test
    @DisplayName("byYear: Dec 31 and Jan 1 land in two buckets")
    void byYear_splitsAtYearBoundary() {
        List<DailyMean> means = calculator.computeDailyMeans(List.of(
                reading("2023-12-31T23:00:00Z", 5.0, null),
                reading("2024-01-01T01:00:00Z", 5.2, null)));

        Map<Integer, List<DailyMean>> buckets = calculator.byYear(means);

        assertThat(buckets).containsOnlyKeys(2023, 2024);
        assertThat(buckets.get(2023)).extracting(DailyMean::getDate).containsExactly(LocalDate.of(2023, 12, 31));
        assertThat(buckets.get(2024)).extracting(DailyMean::getDate).containsExactly(LocalDate.of(2024, 1, 1));
    }

    @Test
    @DisplayName("toReadings: converts hourly entries and drops unparseable timestamps")
    void toReadings_dropsBadTimestamps() {
        Map<String, HourlyReadingEntity> hourly = new LinkedHashMap<>();
        hourly.put("2024-05-01T10:00:00Z", new HourlyReadingEntity("2024-05-01T10:00:00Z", 7.9, 40.0));
        hourly.put("2024-05-01T11:00:00+00:00", new HourlyReadingEntity("2024-05-01T11:00:00+00:00", 7.8, null));
        hourly.put("not-a-date", new HourlyReadingEntity("also-not-a-date", 1.0, 1.0));
        CurrentStationEntity snapshot = CurrentStationEntity.builder()
                .id("environment_canada_08GA072")
                .hourlyReadings(hourly)
                .build();

        List<RawReading> readings = calculator.toReadings(snapshot);

        assertThat(readings).extracting(RawReading::getTimestamp)
                .containsExactly(Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T11:00:00Z"));
        assertThat(readings.get(1).getDischarge()).isNull();
    }
}
