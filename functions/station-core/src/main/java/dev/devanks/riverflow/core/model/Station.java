package dev.devanks.riverflow.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A monitoring station from the catalog. Identity is (provider, code); name and province are
 * informational only.
 */
@Value
@Builder
public class Station {

    @NonNull
    Provider provider;
    @NonNull
    String code;
    String name;
    String province;

    /**
     * Document key shared by station_current and station_data, e.g. {@code environment_canada_08GA072}.
     */
    public String getKey() {
        return provider.getId() + "_" + code;
    }
}
