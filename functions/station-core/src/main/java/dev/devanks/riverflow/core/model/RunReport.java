package dev.devanks.riverflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Result of one job run: per-station outcomes plus the counts derived from them.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {

    public enum Status {
        SUCCESS, PARTIAL_SUCCESS, FAILURE
    }

    private String job;
    private Status status;
    private int stationsProcessed;
    private int successCount;
    private int failureCount;
    private int skippedCount;
    private Integer commitCount;      // Daily aggregation only
    private Integer failedBatchCount; // Daily aggregation only
    private Long durationMs;
    private List<StationOutcome> outcomes;

    public static RunReport of(String job, List<StationOutcome> outcomes, Instant start) {
        return from(job, outcomes, start).build();
    }

    /**
     * Builder pre-populated with the counts and status derived from {@code outcomes}.
     */
    public static RunReportBuilder from(String job, List<StationOutcome> outcomes, Instant start) {
        int success = count(outcomes, StationOutcome.Status.SUCCESS);
        int failure = count(outcomes, StationOutcome.Status.FAILURE);
        int skipped = count(outcomes, StationOutcome.Status.SKIPPED);
        return RunReport.builder()
                .job(job)
                .status(statusOf(success, failure))
                .stationsProcessed(outcomes.size())
                .successCount(success)
                .failureCount(failure)
                .skippedCount(skipped)
                .durationMs(ChronoUnit.MILLIS.between(start, Instant.now()))
                .outcomes(List.copyOf(outcomes));
    }

    static Status statusOf(int success, int failure) {
        if (failure == 0) {
            return Status.SUCCESS;
        }
        return success == 0 ? Status.FAILURE : Status.PARTIAL_SUCCESS;
    }

    private static int count(List<StationOutcome> outcomes, StationOutcome.Status status) {
        return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
    }
}
