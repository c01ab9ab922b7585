package dev.devanks.riverflow.core.model;

import dev.devanks.riverflow.core.exception.FetchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunReport Unit Tests")
class RunReportTest {

    @ParameterizedTest(name = "{0} successes, {1} failures -> {2}")
    @CsvSource({
            "3, 0, SUCCESS",
            "0, 0, SUCCESS",
            "0, 2, FAILURE",
            "1, 1, PARTIAL_SUCCESS"
    })
    void statusOf_derivesOverallStatus(int success, int failure, RunReport.Status expected) {
        assertThat(RunReport.statusOf(success, failure)).isEqualTo(expected);
    }

    @Test
    @DisplayName("of: counts outcomes per status, skipped counts toward neither side")
    void of_countsOutcomes() {
        List<StationOutcome> outcomes = List.of(
                StationOutcome.success("a", 10, "ok"),
                StationOutcome.skipped("b", "no readings"),
                StationOutcome.failure("c", new FetchException("HTTP 503")));

        RunReport report = RunReport.of("realtime", outcomes, Instant.now());

        assertThat(report.getStatus()).isEqualTo(RunReport.Status.PARTIAL_SUCCESS);
        assertThat(report.getStationsProcessed()).isEqualTo(3);
        assertThat(report.getSuccessCount()).isEqualTo(1);
        assertThat(report.getSkippedCount()).isEqualTo(1);
        assertThat(report.getFailureCount()).isEqualTo(1);
        assertThat(report.getDurationMs()).isNotNull().isGreaterThanOrEqualTo(0L);
        assertThat(report.getOutcomes().get(2).getErrorType()).isEqualTo(ErrorType.FETCH_ERROR);
        assertThat(report.getOutcomes().get(2).getErrorDetails()).isEqualTo("HTTP 503");
    }

    @Test
    @DisplayName("StationOutcome.failure: unknown exceptions are UNEXPECTED_ERROR")
    void failure_unexpectedException_classified() {
        StationOutcome outcome = StationOutcome.failure("a", new IllegalStateException("boom"));

        assertThat(outcome.isFailure()).isTrue();
        assertThat(outcome.getErrorType()).isEqualTo(ErrorType.UNEXPECTED_ERROR);
    }
}
