package dev.devanks.riverflow.core.entity;

import com.google.cloud.firestore.annotation.DocumentId;
import com.google.cloud.spring.data.firestore.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current conditions snapshot for one station. Always written as a whole document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collectionName = "station_current")
public class CurrentStationEntity {

    @DocumentId
    private String id; // {provider}_{stationCode}

    private String stationId;
    private String provider;
    private HourlyReadingEntity latestReading;
    private String trend;
    @Builder.Default
    private Map<String, HourlyReadingEntity> hourlyReadings = new LinkedHashMap<>(); // Chronological
    private int readingsCount;
    private Instant updatedAt;
}
