package dev.devanks.riverflow.core.client;

import dev.devanks.riverflow.core.model.DailyMean;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.RawReading;
import dev.devanks.riverflow.core.model.Station;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Fetches and parses time series for one station from one upstream network.
 * Pure I/O and parsing; no ordering of the result is guaranteed.
 */
public interface ProviderClient {

    Provider provider();

    /**
     * Realtime readings with timestamps in {@code [from, to]}.
     *
     * @throws dev.devanks.riverflow.core.exception.FetchException on timeout, IO error or non-2xx status
     */
    List<RawReading> fetch(Station station, Instant from, Instant to);

    /**
     * Official daily means for the inclusive date range.
     *
     * @throws dev.devanks.riverflow.core.exception.FetchException on timeout, IO error or non-2xx status
     */
    List<DailyMean> fetchDailyMeans(Station station, LocalDate from, LocalDate to);
}
