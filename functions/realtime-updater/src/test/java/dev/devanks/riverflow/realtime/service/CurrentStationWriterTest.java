package dev.devanks.riverflow.realtime.service;

import dev.devanks.riverflow.core.entity.CurrentStationEntity;
import dev.devanks.riverflow.core.model.ErrorType;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Station;
import dev.devanks.riverflow.core.model.Trend;
import dev.devanks.riverflow.core.repository.CurrentStationRepository;
import dev.devanks.riverflow.realtime.exception.WriteException;
import dev.devanks.riverflow.realtime.mapper.CurrentStationMapper;
import dev.devanks.riverflow.realtime.model.NormalizedReadings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CurrentStationWriter Unit Tests")
class CurrentStationWriterTest {

    private static final Station STATION = Station.builder()
            .provider(Provider.ENVIRONMENT_CANADA)
            .code("08GA072")
            .build();
    private static final Instant UPDATED_AT = Instant.parse("2024-05-01T10:05:00Z");

    @Mock
    private CurrentStationRepository mockRepository;

    @Captor
    private ArgumentCaptor<CurrentStationEntity> entityCaptor;

    private CurrentStationWriter writer;
    private NormalizedReadings readings;

    @BeforeEach
    void setUp() {
        writer = new CurrentStationWriter(mockRepository, new CurrentStationMapper());
        RawReading reading = RawReading.builder()
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .level(7.95)
                .discharge(40.0)
                .build();
        readings = NormalizedReadings.of(List.of(reading), Trend.STABLE);
    }

    @Test
    @DisplayName("write: saves the full snapshot through the repository")
    void write_savesEntity() {
        when(mockRepository.save(entityCaptor.capture()))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0, CurrentStationEntity.class)));

        StepVerifier.create(writer.write(STATION, readings, UPDATED_AT))
                .assertNext(saved -> assertThat(saved.getId()).isEqualTo("environment_canada_08GA072"))
                .verifyComplete();

        CurrentStationEntity captured = entityCaptor.getValue();
        assertThat(captured.getReadingsCount()).isEqualTo(1);
        assertThat(captured.getUpdatedAt()).isEqualTo(UPDATED_AT);
        assertThat(captured.getTrend()).isEqualTo("stable");
    }

    @Test
    @DisplayName("write: a failing save surfaces as WriteException")
    void write_saveFails_mapsToWriteException() {
        when(mockRepository.save(any(CurrentStationEntity.class)))
                .thenReturn(Mono.error(new IllegalStateException("DEADLINE_EXCEEDED")));

        StepVerifier.create(writer.write(STATION, readings, UPDATED_AT))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(WriteException.class)
                            .hasMessageContaining("station_current/environment_canada_08GA072")
                            .hasCauseInstanceOf(IllegalStateException.class);
                    assertThat(((WriteException) e).getErrorType()).isEqualTo(ErrorType.WRITE_ERROR);
                })
                .verify();
    }
}
