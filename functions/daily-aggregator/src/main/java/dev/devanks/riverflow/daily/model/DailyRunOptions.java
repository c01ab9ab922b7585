package dev.devanks.riverflow.daily.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-invocation switches taken from the function payload.
 */
@Value
@Builder
public class DailyRunOptions {

    boolean dryRun;
    Integer historicalDays; // null: use daily.historical-days

    public static DailyRunOptions defaults() {
        return DailyRunOptions.builder().build();
    }
}
