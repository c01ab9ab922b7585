package dev.devanks.riverflow.core.catalog;

import dev.devanks.riverflow.core.config.StationsProperties;
import dev.devanks.riverflow.core.exception.StationCatalogException;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.Station;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StationCatalog Unit Tests")
class StationCatalogTest {

    private StationsProperties properties;
    private StationCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new StationsProperties();
        catalog = new StationCatalog(properties);
    }

    private static StationsProperties.StationEntry entry(Provider provider, String code, String name) {
        var entry = new StationsProperties.StationEntry();
        entry.setProvider(provider);
        entry.setCode(code);
        entry.setName(name);
        entry.setProvince("BC");
        return entry;
    }

    @Test
    @DisplayName("loadStations: returns stations in configuration order, duplicates collapsed")
    void loadStations_preservesOrderAndDropsDuplicates() {
        properties.setCatalog(new ArrayList<>(List.of(
                entry(Provider.ENVIRONMENT_CANADA, "08GA072", "Cheakamus"),
                entry(Provider.ENVIRONMENT_CANADA, "08MF005", "Fraser at Hope"),
                entry(Provider.ENVIRONMENT_CANADA, "08GA072", "Duplicate"))));

        List<Station> stations = catalog.loadStations();

        assertThat(stations).extracting(Station::getKey)
                .containsExactly("environment_canada_08GA072", "environment_canada_08MF005");
        assertThat(stations.get(0).getName()).isEqualTo("Cheakamus");
        assertThat(stations.get(0).getProvince()).isEqualTo("BC");
    }

    @Test
    @DisplayName("loadStations: empty catalog is fatal")
    void loadStations_emptyCatalog_throws() {
        assertThatThrownBy(() -> catalog.loadStations())
                .isInstanceOf(StationCatalogException.class)
                .hasMessageContaining("empty");
    }

    @Test
    @DisplayName("loadStations: entry without a code is fatal")
    void loadStations_blankCode_throws() {
        properties.setCatalog(new ArrayList<>(List.of(entry(Provider.ENVIRONMENT_CANADA, " ", null))));

        assertThatThrownBy(() -> catalog.loadStations())
                .isInstanceOf(StationCatalogException.class)
                .hasMessageContaining("entry 0");
    }
}
