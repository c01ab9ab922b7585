package dev.devanks.riverflow.core.client;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the Environment Canada hydrometric OGC API.
 * Both collections are requested as CSV; the body is parsed by {@code HydrometricCsvParser}.
 */
@FeignClient(name = "hydrometric-api",
        url = "${stations.provider.environment-canada.url}",
        configuration = HydrometricApiClientConfig.class)
public interface HydrometricApiClient {

    /**
     * @param datetime ISO-8601 interval {@code start/end}
     */
    @GetMapping("/collections/hydrometric-realtime/items")
    String getRealtimeReadings(@RequestParam("STATION_NUMBER") String stationNumber,
                               @RequestParam("datetime") String datetime,
                               @RequestParam("limit") int limit,
                               @RequestParam("f") String format);

    @GetMapping("/collections/hydrometric-daily-mean/items")
    String getDailyMeans(@RequestParam("STATION_NUMBER") String stationNumber,
                         @RequestParam("datetime") String datetime,
                         @RequestParam("limit") int limit,
                         @RequestParam("f") String format);
}
