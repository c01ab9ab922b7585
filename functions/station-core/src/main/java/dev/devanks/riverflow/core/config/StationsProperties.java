package dev.devanks.riverflow.core.config;

import dev.devanks.riverflow.core.model.Provider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.hibernate.validator.constraints.URL;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "stations")
public class StationsProperties {

    // One entry per monitored gauge
    @Data
    @Validated
    public static class StationEntry {
        @NotNull
        private Provider provider;
        @NotEmpty
        private String code;
        private String name;
        private String province;
    }

    @Data
    @Validated
    public static class ProviderProperties {
        @NotNull
        @Valid
        private EnvironmentCanadaProperties environmentCanada = new EnvironmentCanadaProperties();
    }

    @Data
    @Validated
    public static class EnvironmentCanadaProperties {
        @NotEmpty
        @URL
        private String url = "https://api.weather.gc.ca";
        @NotEmpty
        private String userAgent = "GCP-Cloud-Function-Riverflow-Feign/1.0";
        @Min(1)
        private int limit = 10000; // Max rows the OGC API returns per request
    }

    @Valid
    private List<StationEntry> catalog = new ArrayList<>();

    @NotNull
    @Valid
    private ProviderProperties provider = new ProviderProperties();
}
