package dev.devanks.riverflow.daily.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.riverflow.core.model.RunReport;
import dev.devanks.riverflow.daily.model.DailyRunOptions;
import dev.devanks.riverflow.daily.service.DailyAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

@Service
@RequiredArgsConstructor
@Slf4j
public class DailyAggregationFunction {

    static final String DRY_RUN = "dryRun";
    static final String HISTORICAL_DAYS = "historicalDays";

    private final DailyAggregator dailyAggregator;

    /**
     * Main function bean: updateDailyAverages. An empty or missing payload runs with the configured
     * defaults.
     */
    @Bean
    public Function<HashMap<String, Object>, RunReport> updateDailyAverages() {
        return payload -> {
            log.info("updateDailyAverages function triggered with payload: {}", payload);
            return dailyAggregator.runUpdate(parseOptions(payload));
        };
    }

    /**
     * @throws IllegalArgumentException if {@code dryRun} is not a boolean or {@code historicalDays}
     *                                  is not a positive integer
     */
    @VisibleForTesting
    static DailyRunOptions parseOptions(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return DailyRunOptions.defaults();
        }
        return DailyRunOptions.builder()
                .dryRun(parseDryRun(payload.get(DRY_RUN)))
                .historicalDays(parseHistoricalDays(payload.get(HISTORICAL_DAYS)))
                .build();
    }

    private static boolean parseDryRun(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.parseBoolean(text);
        }
        throw new IllegalArgumentException("Invalid '" + DRY_RUN + "' in payload: expected true or false but got '" + value + "'");
    }

    private static Integer parseHistoricalDays(Object value) {
        if (value == null) {
            return null;
        }
        long days;
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            days = ((Number) value).longValue();
        } else if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number != Math.rint(number)) {
                throw invalidHistoricalDays(value);
            }
            days = (long) number;
        } else {
            try {
                days = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                throw invalidHistoricalDays(value);
            }
        }
        if (days < 1 || days > Integer.MAX_VALUE) {
            throw invalidHistoricalDays(value);
        }
        return (int) days;
    }

    private static IllegalArgumentException invalidHistoricalDays(Object value) {
        return new IllegalArgumentException(
                "Invalid '" + HISTORICAL_DAYS + "' in payload: expected a positive integer but got '" + value + "'");
    }
}
