// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/service/CurrentStationWriter.java
package dev.devanks.riverflow.realtime.service;

import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.core.repository.CurrentStationRepository;
import dev.devanks.riverflow.realtime.exception.WriteException;
import dev.devanks.riverflow.realtime.mapper.CurrentStationMapper;
import dev.devanks.riverflow.realtime.model.NormalizedReadings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Replaces the whole station_current document; fields from a previous run never survive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CurrentStationWriter {

    private final CurrentStationRepository repository;
    private final CurrentStationMapper mapper;

    public Mono<CurrentStationEntity> write(Station station, NormalizedReadings readings, Instant updatedAt) {
        return Mono.fromCallable(() -> mapper.mapToEntity(station, readings, updatedAt))
                .flatMap(entity -> {
                    log.debug("Writing station_current/{} ({} readings)", entity.getId(), entity.getReadingsCount());
                    return repository.save(entity);
                })
                .doOnSuccess(saved -> log.info("Saved current snapshot for station {}", station.getKey()))
                .onErrorMap(e -> !(e instanceof WriteException),
                        e -> new WriteException("Failed to write station_current/" + station.getKey() + ": " + e.getMessage(), e));
    }
}
