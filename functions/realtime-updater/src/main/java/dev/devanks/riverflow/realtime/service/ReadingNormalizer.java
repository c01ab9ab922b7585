// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/service/ReadingNormalizer.java
package dev.devanks.riverflow.realtime.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Trend;
import dev.devanks.riverflow.realtime.model.NormalizedReadings;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

@Component
public class ReadingNormalizer {

    /**
     * Differences smaller than this (in m or m3/s) are reported as stable.
     */
    public static final double TREND_THRESHOLD = 0.01;

    public NormalizedReadings normalize(List<RawReading> readings) {
        if (readings == null || readings.isEmpty()) {
            return NormalizedReadings.EMPTY;
        }
        List<RawReading> ordered = new ArrayList<>(readings);
        ordered.sort(Comparator.comparing(RawReading::getTimestamp)); // List.sort is stable
        return NormalizedReadings.of(ordered, trendOf(ordered));
    }

    /**
     * Trend from the two most recent readings of an ascending list. Level is compared when both
     * readings have it, otherwise discharge.
     */
    @VisibleForTesting
    static Trend trendOf(List<RawReading> ordered) {
        if (ordered.size() < 2) {
            return Trend.STABLE;
        }
        RawReading newest = ordered.get(ordered.size() - 1);
        RawReading previous = ordered.get(ordered.size() - 2);

        Function<RawReading, Double> measure = bothPresent(newest, previous, RawReading::getLevel)
                ? RawReading::getLevel
                : RawReading::getDischarge;
        if (!bothPresent(newest, previous, measure)) {
            return Trend.STABLE;
        }

        double diff = measure.apply(newest) - measure.apply(previous);
        if (Math.abs(diff) < TREND_THRESHOLD) {
            return Trend.STABLE;
        }
        return diff > 0 ? Trend.RISING : Trend.FALLING;
    }

    private static boolean bothPresent(RawReading a, RawReading b, Function<RawReading, Double> measure) {
        return measure.apply(a) != null && measure.apply(b) != null;
    }
}
