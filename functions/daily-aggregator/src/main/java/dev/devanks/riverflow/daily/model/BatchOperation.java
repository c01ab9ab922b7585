package dev.devanks.riverflow.daily.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Map;

/**
 * One merge write: {@code fields} are merged into the document at {@code documentPath}.
 */
@Value
@Builder
public class BatchOperation {

    @NonNull
    String stationKey;
    @NonNull
    String documentPath;
    @NonNull
    Map<String, Object> fields;
}
