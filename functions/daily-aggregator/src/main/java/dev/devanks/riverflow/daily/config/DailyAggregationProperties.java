package dev.devanks.riverflow.daily.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "daily")
public class DailyAggregationProperties {

    /**
     * Import the provider's official daily means for stations that have no metadata document yet.
     */
    private boolean backfillEnabled = true;

    /**
     * Days of official daily means fetched by a backfill. Overridable per run with the
     * {@code historicalDays} payload key.
     */
    @Min(1)
    private int historicalDays = 1825; // 5 years

    /**
     * How long a single batch commit may take before it is recorded as failed.
     */
    @NotNull
    private Duration commitTimeout = Duration.ofSeconds(60);

    /**
     * How long a single Firestore document read may take.
     */
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(30);
}
