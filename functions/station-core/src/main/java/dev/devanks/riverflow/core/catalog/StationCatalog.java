package dev.devanks.riverflow.core.catalog;

import dev.devanks.riverflow.core.config.StationsProperties;
import dev.devanks.riverflow.core.exception.StationCatalogException;
import dev.devanks.riverflow.core.model.Station;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Config-defined set of stations both jobs fan out over.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StationCatalog {

    private final StationsProperties properties;

    /**
     * Loads the configured stations, collapsing duplicate keys onto their first entry.
     *
     * @return the stations in configuration order
     * @throws StationCatalogException if the catalog is missing, empty or has an incomplete entry
     */
    public List<Station> loadStations() {
        List<StationsProperties.StationEntry> entries = properties.getCatalog();
        if (entries == null || entries.isEmpty()) {
            throw new StationCatalogException("Station catalog is empty; configure stations.catalog");
        }

        Map<String, Station> byKey = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            var station = toStation(entries.get(i), i);
            if (byKey.putIfAbsent(station.getKey(), station) != null) {
                log.warn("Duplicate catalog entry for station {} ignored.", station.getKey());
            }
        }
        log.info("Loaded {} stations from catalog.", byKey.size());
        return List.copyOf(byKey.values());
    }

    private Station toStation(StationsProperties.StationEntry entry, int index) {
        if (entry == null || entry.getProvider() == null || entry.getCode() == null || entry.getCode().isBlank()) {
            throw new StationCatalogException("Station catalog entry " + index + " needs a provider and a code");
        }
        return Station.builder()
                .provider(entry.getProvider())
                .code(entry.getCode().trim())
                .name(entry.getName())
                .province(entry.getProvince())
                .build();
    }
}
