package dev.devanks.riverflow.core.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * One observation as returned by the provider. Either measurement may be absent.
 */
@Value
@Builder
public class RawReading {

    @NonNull
    Instant timestamp;
    Double level;     // m
    Double discharge; // m3/s
}
