package dev.devanks.riverflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Trend {

    RISING("rising"),
    FALLING("falling"),
    STABLE("stable");

    @JsonValue
    private final String value; // Stored form in station_current
}
