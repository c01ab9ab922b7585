package dev.devanks.riverflow.core.client;

import dev.devanks.riverflow.core.config.StationsProperties;
import dev.devanks.riverflow.core.exception.FetchException;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.core.parser.HydrometricCsvParser;
import feign.FeignException;
import feign.RetryableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.function.Supplier;

@Component
@RequiredArgsConstructor
@Slf4j
public class EnvironmentCanadaProviderClient implements ProviderClient {

    private static final String FORMAT_CSV = "csv";

    private final HydrometricApiClient apiClient;
    private final HydrometricCsvParser csvParser;
    private final StationsProperties properties;

    @Override
    public Provider provider() {
        return Provider.ENVIRONMENT_CANADA;
    }

    @Override
    public List<RawReading> fetch(Station station, Instant from, Instant to) {
        String interval = from.truncatedTo(ChronoUnit.SECONDS) + "/" + to.truncatedTo(ChronoUnit.SECONDS);
        log.debug("Fetching realtime readings for {} over {}", station.getKey(), interval);

        String body = call(station, "realtime readings",
                () -> apiClient.getRealtimeReadings(station.getCode(), interval, limit(), FORMAT_CSV));
        List<RawReading> readings = csvParser.parseReadings(body, station.getKey());
        log.info("Fetched {} realtime readings for {}", readings.size(), station.getKey());
        return readings;
    }

    @Override
    public List<DailyMean> fetchDailyMeans(Station station, LocalDate from, LocalDate to) {
        String interval = from + "T00:00:00Z/" + to + "T23:59:59Z";
        log.debug("Fetching daily means for {} over {}", station.getKey(), interval);

        String body = call(station, "daily means",
                () -> apiClient.getDailyMeans(station.getCode(), interval, limit(), FORMAT_CSV));
        List<DailyMean> dailyMeans = csvParser.parseDailyMeans(body, station.getKey());
        log.info("Fetched {} daily means for {}", dailyMeans.size(), station.getKey());
        return dailyMeans;
    }

    private String call(Station station, String what, Supplier<String> request) {
        try {
            return request.get();
        } catch (RetryableException e) {
            // Connect/read timeouts and IO errors
            log.error("Hydrometric API {} request for {} failed: {}", what, station.getKey(), e.getMessage(), e);
            throw new FetchException("Timeout or IO error fetching " + what + " for " + station.getKey()
                    + ": " + e.getMessage(), e);
        } catch (FeignException e) {
            log.error("Hydrometric API {} request for {} failed: Status={}, Body={}",
                    what, station.getKey(), e.status(), e.contentUTF8(), e);
            throw new FetchException("Error fetching " + what + " for " + station.getKey()
                    + " (HTTP " + e.status() + "): " + e.getMessage(), e);
        }
    }

    private int limit() {
        return properties.getProvider().getEnvironmentCanada().getLimit();
    }
}
