package dev.devanks.riverflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Upstream hydrometric networks. The id is used as the Firestore document key prefix.
 */
@Getter
@RequiredArgsConstructor
public enum Provider {

    ENVIRONMENT_CANADA("environment_canada"),
    USGS("usgs");

    @JsonValue
    private final String id;

    @Override
    public String toString() {
        return id;
    }
}
