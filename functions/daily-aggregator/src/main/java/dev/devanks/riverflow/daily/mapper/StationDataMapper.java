package dev.devanks.riverflow.daily.mapper;

import com.google.cloud.Timestamp;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.Station;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Field layout of the station_data documents. Field names are snake_case to stay readable by the
 * existing consumers of the archive.
 */
@Component
@Slf4j
public class StationDataMapper {

    public static final String YEAR = "year";
    public static final String DAILY_READINGS = "daily_readings";
    public static final String UPDATED_AT = "updated_at";
    public static final String MEAN_LEVEL = "mean_level";
    public static final String MEAN_DISCHARGE = "mean_discharge";
    public static final String READING_COUNT = "reading_count";

    public static final String STATION_ID = "station_id";
    public static final String PROVIDER = "provider";
    public static final String STATION_NAME = "station_name";
    public static final String PROVINCE = "province";
    public static final String IS_ACTIVE = "is_active";
    public static final String FIRST_DATA_FETCH = "first_data_fetch";
    public static final String CREATED_AT = "created_at";
    public static final String LAST_UPDATED = "last_updated";

    /**
     * Merge payload for one yearly bucket. Each date entry is written whole; an absent
     * {@code reading_count} marks an official mean.
     */
    public Map<String, Object> toBucketFields(int year, Collection<DailyMean> means, Instant updatedAt) {
        Map<String, Object> dailyReadings = new TreeMap<>();
        for (DailyMean mean : means) {
            Map<String, Object> entry = new HashMap<>(); // values may be null
            entry.put(MEAN_LEVEL, mean.getMeanLevel());
            entry.put(MEAN_DISCHARGE, mean.getMeanDischarge());
            if (mean.getReadingCount() != null) {
                entry.put(READING_COUNT, mean.getReadingCount());
            }
            dailyReadings.put(mean.getDate().toString(), entry);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(YEAR, year);
        fields.put(DAILY_READINGS, dailyReadings);
        fields.put(UPDATED_AT, toTimestamp(updatedAt));
        return fields;
    }

    /**
     * Reads back the {@code daily_readings} map of a bucket. Entries with an unparseable date are
     * ignored.
     */
    public Map<LocalDate, DailyMean> fromBucketFields(Map<?, ?> dailyReadings) {
        Map<LocalDate, DailyMean> means = new TreeMap<>();
        if (dailyReadings == null) {
            return means;
        }
        dailyReadings.forEach((dateKey, value) -> {
            if (!(dateKey instanceof String) || !(value instanceof Map)) {
                return;
            }
            try {
                LocalDate date = LocalDate.parse((String) dateKey);
                Map<?, ?> entry = (Map<?, ?>) value;
                means.put(date, DailyMean.builder()
                        .date(date)
                        .meanLevel(toDouble(entry.get(MEAN_LEVEL)))
                        .meanDischarge(toDouble(entry.get(MEAN_DISCHARGE)))
                        .readingCount(toInteger(entry.get(READING_COUNT)))
                        .build());
            } catch (DateTimeParseException e) {
                log.debug("Ignoring stored daily entry with bad date key '{}'", dateKey);
            }
        });
        return means;
    }

    /**
     * Merge payload created by a historical backfill.
     */
    public Map<String, Object> toNewMetadata(Station station, Instant now) {
        Timestamp timestamp = toTimestamp(now);
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(STATION_ID, station.getCode());
        fields.put(PROVIDER, station.getProvider().getId());
        fields.put(STATION_NAME, station.getName());
        fields.put(PROVINCE, station.getProvince());
        fields.put(IS_ACTIVE, true);
        fields.put(FIRST_DATA_FETCH, timestamp);
        fields.put(CREATED_AT, timestamp);
        fields.put(LAST_UPDATED, timestamp);
        return fields;
    }

    /**
     * Merge payload touched by every successful aggregation.
     */
    public Map<String, Object> toLastUpdated(Station station, Instant now) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(STATION_ID, station.getCode());
        fields.put(PROVIDER, station.getProvider().getId());
        fields.put(LAST_UPDATED, toTimestamp(now));
        return fields;
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static Double toDouble(Object value) {
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static Integer toInteger(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }
}
