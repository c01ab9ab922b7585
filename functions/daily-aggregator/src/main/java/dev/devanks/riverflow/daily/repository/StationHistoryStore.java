package dev.devanks.riverflow.daily.repository;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.repository.CurrentStationRepository;
import dev.devanks.riverflow.daily.config.DailyAggregationProperties;
import dev.devanks.riverflow.daily.exception.StoreReadException;
import dev.devanks.riverflow.daily.mapper.StationDataMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reads the documents the daily job needs: the realtime snapshot it aggregates and the
 * station_data documents it merges into.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class StationHistoryStore {

    private final Firestore firestore;
    private final CurrentStationRepository currentStationRepository;
    private final StationDataMapper mapper;
    private final DailyAggregationProperties properties;

    public static String yearlyBucketPath(String stationKey, int year) {
        return "station_data/" + stationKey + "/readings/" + year;
    }

    public static String metadataPath(String stationKey) {
        return "station_data/" + stationKey + "/metadata/info";
    }

    public Optional<CurrentStationEntity> readCurrent(String stationKey) {
        try {
            return currentStationRepository.findById(stationKey).blockOptional(properties.getReadTimeout());
        } catch (RuntimeException e) {
            throw new StoreReadException("Failed to read station_current/" + stationKey + ": " + e.getMessage(), e);
        }
    }

    /**
     * @return the stored daily entries of one yearly bucket, empty when the bucket does not exist yet
     */
    public Map<LocalDate, DailyMean> readDailyReadings(String stationKey, int year) {
        DocumentSnapshot snapshot = read(yearlyBucketPath(stationKey, year));
        if (!snapshot.exists()) {
            return Map.of();
        }
        Object dailyReadings = snapshot.get(StationDataMapper.DAILY_READINGS);
        if (!(dailyReadings instanceof Map)) {
            log.warn("Bucket {} has no {} map; treating it as empty.", yearlyBucketPath(stationKey, year), StationDataMapper.DAILY_READINGS);
            return Map.of();
        }
        return mapper.fromBucketFields((Map<?, ?>) dailyReadings);
    }

    public boolean hasMetadata(String stationKey) {
        return read(metadataPath(stationKey)).exists();
    }

    private DocumentSnapshot read(String path) {
        log.debug("Reading {}", path);
        try {
            return firestore.document(path).get().get(properties.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreReadException("Interrupted while reading " + path, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StoreReadException("Failed to read " + path + ": " + cause.getMessage(), cause);
        } catch (TimeoutException | RuntimeException e) {
            throw new StoreReadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }
}
