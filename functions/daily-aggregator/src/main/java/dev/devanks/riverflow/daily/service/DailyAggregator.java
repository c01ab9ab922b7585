package dev.devanks.riverflow.daily.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.riverflow.core.catalog.StationCatalog;
import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.RunReport;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.core.model.StationOutcome;
import dev.devanks.riverflow.daily.batch.BatchCommitter;
import dev.devanks.riverflow.daily.batch.BatchCommitterFactory;
import dev.devanks.riverflow.daily.config.DailyAggregationProperties;
import dev.devanks.riverflow.daily.exception.BatchCommitException;
import dev.devanks.riverflow.daily.mapper.StationDataMapper;
import dev.devanks.riverflow.daily.model.BatchOperation;
import dev.devanks.riverflow.daily.model.CommitReport;
import dev.devanks.riverflow.daily.model.DailyRunOptions;
import dev.devanks.riverflow.daily.repository.StationHistoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rolls the hourly readings of every station's realtime snapshot up into daily means and merges
 * them into the yearly buckets of station_data. Stations run one after another through a single
 * {@link BatchCommitter}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyAggregator {

    public static final String JOB_NAME = "daily-aggregation";

    private final StationCatalog stationCatalog;
    private final StationHistoryStore historyStore;
    private final DailyMeanCalculator calculator;
    private final StationDataMapper mapper;
    private final HistoricalBackfillService backfillService;
    private final BatchCommitterFactory committerFactory;
    private final DailyAggregationProperties properties;

    /**
     * @throws dev.devanks.riverflow.core.exception.StationCatalogException if the catalog cannot be loaded
     */
    public RunReport runUpdate(DailyRunOptions options) {
        Instant start = Instant.now();
        int historicalDays = options.getHistoricalDays() != null ? options.getHistoricalDays() : properties.getHistoricalDays();
        log.info("Starting daily aggregation (dryRun={}, backfill={}, historicalDays={}).",
                options.isDryRun(), properties.isBackfillEnabled(), historicalDays);

        List<Station> stations = stationCatalog.loadStations();
        BatchCommitter committer = committerFactory.open();

        List<StationOutcome> outcomes = new ArrayList<>(stations.size());
        for (Station station : stations) {
            outcomes.add(processStation(station, options.isDryRun(), historicalDays, committer, Instant.now()));
        }

        CommitReport commitReport = committer.complete();
        List<StationOutcome> finalOutcomes = applyBatchFailures(outcomes, commitReport.getFailedStations());

        RunReport report = RunReport.from(JOB_NAME, finalOutcomes, start)
                .commitCount(commitReport.getCommitCount())
                .failedBatchCount(commitReport.getFailedBatchCount())
                .build();
        log.info("Daily aggregation finished with status {}: {} succeeded, {} skipped, {} failed; {} batches committed, {} failed, in {} ms.",
                report.getStatus(), report.getSuccessCount(), report.getSkippedCount(), report.getFailureCount(),
                report.getCommitCount(), report.getFailedBatchCount(), report.getDurationMs());
        return report;
    }

    @VisibleForTesting
    StationOutcome processStation(Station station, boolean dryRun, int historicalDays,
                                  BatchCommitter committer, Instant now) {
        String key = station.getKey();
        try {
            Map<LocalDate, DailyMean> backfilled = Map.of();
            if (properties.isBackfillEnabled() && !historyStore.hasMetadata(key)) {
                backfilled = backfillService.backfill(station, historicalDays, dryRun, committer, now);
            }

            Optional<CurrentStationEntity> snapshot = historyStore.readCurrent(key);
            if (snapshot.isEmpty() || snapshot.get().getHourlyReadings() == null || snapshot.get().getHourlyReadings().isEmpty()) {
                log.warn("No hourly readings in station_current/{}; nothing to aggregate.", key);
                return StationOutcome.skipped(key, "No hourly readings to aggregate");
            }

            List<DailyMean> computed = calculator.computeDailyMeans(calculator.toReadings(snapshot.get()));
            List<BatchOperation> operations = new ArrayList<>();
            int daysWritten = 0;
            for (Map.Entry<Integer, List<DailyMean>> bucket : calculator.byYear(computed).entrySet()) {
                int year = bucket.getKey();
                Map<LocalDate, DailyMean> existing = new HashMap<>(historyStore.readDailyReadings(key, year));
                existing.putAll(backfilled);
                List<DailyMean> toWrite = bucket.getValue().stream()
                        .filter(mean -> shouldWrite(mean, existing.get(mean.getDate())))
                        .toList();
                if (toWrite.isEmpty()) {
                    log.debug("Bucket {} for {} already holds equal or better data.", year, key);
                    continue;
                }
                daysWritten += toWrite.size();
                operations.add(BatchOperation.builder()
                        .stationKey(key)
                        .documentPath(StationHistoryStore.yearlyBucketPath(key, year))
                        .fields(mapper.toBucketFields(year, toWrite, now))
                        .build());
            }
            operations.add(BatchOperation.builder()
                    .stationKey(key)
                    .documentPath(StationHistoryStore.metadataPath(key))
                    .fields(mapper.toLastUpdated(station, now))
                    .build());

            if (dryRun) {
                log.info("[dry run] {}: would write {} of {} computed days in {} operations.",
                        key, daysWritten, computed.size(), operations.size());
            } else {
                committer.enqueueAll(operations);
                log.info("{}: queued {} of {} computed days.", key, daysWritten, computed.size());
            }
            return StationOutcome.success(key, daysWritten,
                    (dryRun ? "Dry run: " : "") + daysWritten + " daily means across " + (operations.size() - 1) + " year buckets");
        } catch (RuntimeException e) {
            log.error("Daily aggregation failed for station {}: {}", key, e.getMessage(), e);
            return StationOutcome.failure(key, e);
        }
    }

    /**
     * A computed mean replaces a stored one only when it reflects at least as many readings.
     * Stored entries without a count are official means and are kept.
     */
    @VisibleForTesting
    static boolean shouldWrite(DailyMean computed, DailyMean existing) {
        if (existing == null) {
            return true;
        }
        if (existing.getReadingCount() == null) {
            return false;
        }
        return computed.getReadingCount() != null && computed.getReadingCount() >= existing.getReadingCount();
    }

    private static List<StationOutcome> applyBatchFailures(List<StationOutcome> outcomes,
                                                           Map<String, BatchCommitException> failedStations) {
        if (failedStations.isEmpty()) {
            return outcomes;
        }
        List<StationOutcome> result = new ArrayList<>(outcomes.size());
        for (StationOutcome outcome : outcomes) {
            BatchCommitException error = failedStations.get(outcome.getStationKey());
            if (error != null && !outcome.isFailure()) {
                log.warn("Station {} had writes in a failed batch; marking it failed.", outcome.getStationKey());
                result.add(StationOutcome.failure(outcome.getStationKey(), error));
            } else {
                result.add(outcome);
            }
        }
        return result;
    }
}
