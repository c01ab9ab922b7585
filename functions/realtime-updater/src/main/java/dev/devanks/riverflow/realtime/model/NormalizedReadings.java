// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/model/NormalizedReadings.java
package dev.devanks.riverflow.realtime.model;

import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Trend;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Readings sorted ascending by timestamp, with the newest reading and the derived trend.
 * An empty fetch yields {@link #EMPTY}; there is no synthesized latest reading.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NormalizedReadings {

    public static final NormalizedReadings EMPTY = new NormalizedReadings(null, Trend.STABLE, List.of());

    RawReading latestReading;
    Trend trend;
    List<RawReading> ordered;

    public static NormalizedReadings of(List<RawReading> ordered, Trend trend) {
        if (ordered.isEmpty()) {
            return EMPTY;
        }
        return new NormalizedReadings(ordered.get(ordered.size() - 1), trend, List.copyOf(ordered));
    }

    public Optional<RawReading> getLatest() {
        return Optional.ofNullable(latestReading);
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    public int size() {
        return ordered.size();
    }
}
