package dev.devanks.riverflow.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDate;

/**
 * Mean level/discharge for one UTC calendar day.
 * <p>
 * {@code readingCount} is the number of readings the mean was computed from. It is null for
 * means taken from the provider's official daily series.
 */
@Value
@Builder(toBuilder = true)
public class DailyMean {

    @NonNull
    LocalDate date;
    Double meanLevel;
    Double meanDischarge;
    Integer readingCount;

    public int getYear() {
        return date.getYear();
    }
}
