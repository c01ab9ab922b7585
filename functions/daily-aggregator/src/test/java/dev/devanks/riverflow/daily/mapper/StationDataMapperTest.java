package dev.devanks.riverflow.daily.mapper;

import com.google.cloud.Timestamp;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.Station;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("StationDataMapper Unit Tests")
class StationDataMapperTest {

    private static final Instant NOW = Instant.parse("2024-05-02T06:00:00Z");

    private final StationDataMapper mapper = new StationDataMapper();

    @Test
    @DisplayName("toBucketFields: year, dated entries and updated_at; no reading_count for official means")
    @SuppressWarnings("unchecked")
    void toBucketFields_layout() {
        List<DailyMean> means = List.of(
                DailyMean.builder().date(LocalDate.of(2024, 5, 1)).meanLevel(7.5).readingCount(24).build(),
                DailyMean.builder().date(LocalDate.of(2024, 4, 30)).meanDischarge(40.0).build());

        Map<String, Object> fields = mapper.toBucketFields(2024, means, NOW);

        assertThat(fields).containsEntry(StationDataMapper.YEAR, 2024)
                .containsEntry(StationDataMapper.UPDATED_AT, Timestamp.ofTimeSecondsAndNanos(NOW.getEpochSecond(), 0));
        Map<String, Map<String, Object>> daily = (Map<String, Map<String, Object>>) fields.get(StationDataMapper.DAILY_READINGS);
        assertThat(daily.keySet()).containsExactly("2024-04-30", "2024-05-01");
        assertThat(daily.get("2024-05-01"))
                .containsEntry(StationDataMapper.MEAN_LEVEL, 7.5)
                .containsEntry(StationDataMapper.MEAN_DISCHARGE, null)
                .containsEntry(StationDataMapper.READING_COUNT, 24);
        assertThat(daily.get("2024-04-30")).doesNotContainKey(StationDataMapper.READING_COUNT);
    }

    @Test
    @DisplayName("fromBucketFields: ignores malformed entries")
    void fromBucketFields_ignoresMalformed() {
        Map<Object, Object> stored = new HashMap<>();
        stored.put("2024-05-01", Map.of("mean_level", 7.5, "reading_count", 3L));
        stored.put("garbage", Map.of("mean_level", 1.0));
        stored.put("2024-05-02", "not-a-map");
        stored.put(20240503, Map.of("mean_level", 2.0));

        Map<LocalDate, DailyMean> result = mapper.fromBucketFields(stored);

        assertThat(result).containsOnlyKeys(LocalDate.of(2024, 5, 1));
        assertThat(result.get(LocalDate.of(2024, 5, 1)).getReadingCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("toNewMetadata and toLastUpdated: station identity with timestamps")
    void metadata() {
        Station station = Station.builder().provider(Provider.ENVIRONMENT_CANADA).code("08GA072").name("Cheakamus").province("BC").build();

        assertThat(mapper.toNewMetadata(station, NOW))
                .containsEntry(StationDataMapper.STATION_ID, "08GA072")
                .containsEntry(StationDataMapper.PROVIDER, "environment_canada")
                .containsEntry(StationDataMapper.IS_ACTIVE, true)
                .containsKeys(StationDataMapper.FIRST_DATA_FETCH, StationDataMapper.CREATED_AT, StationDataMapper.LAST_UPDATED);
        assertThat(mapper.toLastUpdated(station, NOW))
                .containsOnlyKeys(StationDataMapper.STATION_ID, StationDataMapper.PROVIDER, StationDataMapper.LAST_UPDATED);
    }
}
