package dev.devanks.riverflow.core.client;

import dev.devanks.riverflow.core.exception.FetchException;
import dev.devanks.riverflow.core.model.Provider;
import dev.devanks.riverflow.core.model.Station;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ProviderClientRegistry {

    private final Map<Provider, ProviderClient> clients = new EnumMap<>(Provider.class);

    public ProviderClientRegistry(List<ProviderClient> providerClients) {
        providerClients.forEach(client -> clients.put(client.provider(), client));
    }

    /**
     * @throws FetchException if no client is registered for the station's provider
     */
    public ProviderClient forStation(Station station) {
        var client = clients.get(station.getProvider());
        if (client == null) {
            throw new FetchException("No provider client registered for " + station.getProvider()
                    + " (station " + station.getKey() + ")");
        }
        return client;
    }
}
