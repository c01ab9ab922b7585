// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/mapper/CurrentStationMapper.java
package dev.devanks.riverflow.realtime.mapper;

import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.entity.HourlyReadingEntity;
import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.realtime.model.NormalizedReadings;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class CurrentStationMapper {

    public CurrentStationEntity mapToEntity(Station station, NormalizedReadings readings, Instant updatedAt) {
        Map<String, HourlyReadingEntity> hourly = new LinkedHashMap<>();
        for (RawReading reading : readings.getOrdered()) {
            HourlyReadingEntity entry = toHourly(reading);
            hourly.put(entry.getDatetime(), entry); // Same timestamp twice: later one wins
        }

        return CurrentStationEntity.builder()
                .id(station.getKey())
                .stationId(station.getCode())
                .provider(station.getProvider().getId())
                .latestReading(readings.getLatest().map(this::toHourly).orElse(null))
                .trend(readings.getTrend().getValue())
                .hourlyReadings(hourly)
                .readingsCount(readings.size())
                .updatedAt(updatedAt)
                .build();
    }

    private HourlyReadingEntity toHourly(RawReading reading) {
        return HourlyReadingEntity.builder()
                .datetime(reading.getTimestamp().toString())
                .level(reading.getLevel())
                .discharge(reading.getDischarge())
                .build();
    }
}
