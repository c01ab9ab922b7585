// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/service/RealtimeOrchestrator.java
package dev.devanks.riverflow.realtime.service;

import dev.devanks.riverflow.core.catalog.StationCatalog;
import dev.devanks.riverflow.core.client.ProviderClientRegistry;
import dev.devanks.riverflow.core.model.RunReport;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.core.model.StationOutcome;
import dev.devanks.riverflow.realtime.config.RealtimeProperties;
import dev.devanks.riverflow.realtime.model.NormalizedReadings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Fetches, normalizes and writes the current snapshot for every catalog station.
 * One station failing never stops the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RealtimeOrchestrator {

    public static final String JOB_NAME = "realtime-update";

    private final StationCatalog stationCatalog;
    private final ProviderClientRegistry clientRegistry;
    private final ReadingNormalizer normalizer;
    private final CurrentStationWriter writer;
    private final RealtimeProperties properties;

    /**
     * @return one outcome per catalog station, in catalog order
     * @throws dev.devanks.riverflow.core.exception.StationCatalogException if the catalog cannot be loaded
     */
    public RunReport runUpdate() {
        Instant start = Instant.now();
        log.info("[Idle] Starting realtime update (window {}h, concurrency {}).",
                properties.getWindowHours(), properties.getMaxConcurrency());

        // Catalog problems abort the run before any station is touched.
        List<Station> stations = stationCatalog.loadStations();

        Instant to = Instant.now();
        Instant from = to.minus(Duration.ofHours(properties.getWindowHours()));

        log.info("[Fanning-out] Updating {} stations.", stations.size());
        List<StationOutcome> outcomes = Flux.fromIterable(stations)
                .flatMapSequential(station -> updateStation(station, from, to), properties.getMaxConcurrency())
                .collectList()
                .block();
        log.info("[Collecting] All {} station tasks completed.", outcomes.size());

        RunReport report = RunReport.of(JOB_NAME, outcomes, start);
        log.info("[Done] Realtime update finished with status {}: {} succeeded, {} skipped, {} failed in {} ms.",
                report.getStatus(), report.getSuccessCount(), report.getSkippedCount(),
                report.getFailureCount(), report.getDurationMs());
        return report;
    }

    private Mono<StationOutcome> updateStation(Station station, Instant from, Instant to) {
        String key = station.getKey();
        return Mono.fromCallable(() -> {
                    log.info("Fetching readings for station {}", key);
                    return clientRegistry.forStation(station).fetch(station, from, to);
                })
                .subscribeOn(Schedulers.boundedElastic()) // Feign calls block
                .map(normalizer::normalize)
                .flatMap(readings -> {
                    if (readings.isEmpty()) {
                        log.warn("No readings returned for station {}; leaving its snapshot untouched.", key);
                        return Mono.just(StationOutcome.skipped(key, "No readings in window"));
                    }
                    return writeSnapshot(station, readings);
                })
                .onErrorResume(e -> {
                    log.error("Realtime update failed for station {}: {}", key, e.getMessage(), e);
                    return Mono.just(StationOutcome.failure(key, e));
                });
    }

    private Mono<StationOutcome> writeSnapshot(Station station, NormalizedReadings readings) {
        return writer.write(station, readings, Instant.now())
                .map(saved -> StationOutcome.success(station.getKey(), readings.size(),
                        "Updated with " + readings.size() + " readings, trend " + readings.getTrend().getValue()));
    }
}
