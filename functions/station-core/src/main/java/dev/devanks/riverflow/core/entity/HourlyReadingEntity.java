package dev.devanks.riverflow.core.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Nested value of {@code latestReading} and {@code hourlyReadings} in station_current.
 * The timestamp is kept as an ISO-8601 string so it can double as the map key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HourlyReadingEntity {

    private String datetime;
    private Double level;
    private Double discharge;
}
