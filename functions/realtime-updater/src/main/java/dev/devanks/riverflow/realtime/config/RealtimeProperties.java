// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/config/RealtimeProperties.java
package dev.devanks.riverflow.realtime.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "realtime")
public class RealtimeProperties {

    /**
     * How far back each run fetches readings. Also bounds what the daily job can aggregate.
     */
    @Min(1)
    @Max(2160)
    private int windowHours = 720; // 30 days

    /**
     * Upper bound on stations fetched at the same time (client-side rate limit for the provider).
     */
    @Min(1)
    private int maxConcurrency = 8;
}
