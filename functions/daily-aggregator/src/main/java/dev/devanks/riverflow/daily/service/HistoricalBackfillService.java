package dev.devanks.riverflow.daily.service;

import dev.devanks.riverflow.core.client.ProviderClientRegistry;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.daily.batch.BatchCommitter;
import dev.devanks.riverflow.daily.mapper.StationDataMapper;
import dev.devanks.riverflow.daily.model.BatchOperation;
import dev.devanks.riverflow.daily.repository.StationHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.time.ZoneOffset.UTC;

/**
 * Seeds the archive of a station seen for the first time with the provider's official daily means
 * and creates its metadata document.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoricalBackfillService {

    private final ProviderClientRegistry clientRegistry;
    private final StationHistoryStore historyStore;
    private final DailyMeanCalculator calculator;
    private final StationDataMapper mapper;

    /**
     * Fetches {@code historicalDays} of official means ending yesterday (UTC) and queues the dates
     * the archive does not hold yet.
     *
     * @return the official means queued by this call, by date (what a dry run would have queued)
     * @throws dev.devanks.riverflow.core.exception.FetchException if the provider call fails
     * @throws dev.devanks.riverflow.daily.exception.StoreReadException if an existing bucket cannot be read
     */
    public Map<LocalDate, DailyMean> backfill(Station station, int historicalDays, boolean dryRun,
                                              BatchCommitter committer, Instant now) {
        String key = station.getKey();
        LocalDate to = now.atZone(UTC).toLocalDate().minusDays(1);
        LocalDate from = to.minusDays(historicalDays - 1L);
        log.info("Backfilling {} with official daily means from {} to {}.", key, from, to);

        List<DailyMean> official = clientRegistry.forStation(station).fetchDailyMeans(station, from, to);

        Map<LocalDate, DailyMean> queued = new TreeMap<>();
        List<BatchOperation> operations = new ArrayList<>();
        calculator.byYear(stripCounts(official)).forEach((year, means) -> {
            Map<LocalDate, DailyMean> existing = historyStore.readDailyReadings(key, year);
            List<DailyMean> missing = means.stream()
                    .filter(mean -> !existing.containsKey(mean.getDate()))
                    .toList();
            if (missing.isEmpty()) {
                return;
            }
            missing.forEach(mean -> queued.put(mean.getDate(), mean));
            operations.add(BatchOperation.builder()
                    .stationKey(key)
                    .documentPath(StationHistoryStore.yearlyBucketPath(key, year))
                    .fields(mapper.toBucketFields(year, missing, now))
                    .build());
        });
        operations.add(BatchOperation.builder()
                .stationKey(key)
                .documentPath(StationHistoryStore.metadataPath(key))
                .fields(mapper.toNewMetadata(station, now))
                .build());

        if (dryRun) {
            log.info("[dry run] Backfill for {} would write {} days in {} operations.", key, queued.size(), operations.size());
        } else {
            committer.enqueueAll(operations); // buckets and metadata commit together
            log.info("Backfill for {} queued {} official days ({} fetched).", key, queued.size(), official.size());
        }
        return queued;
    }

    // Official means never carry a count, whatever the parser produced.
    private static List<DailyMean> stripCounts(List<DailyMean> official) {
        return official.stream()
                .map(mean -> mean.toBuilder().readingCount(null).build())
                .toList();
    }
}
