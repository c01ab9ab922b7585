package dev.devanks.riverflow.daily.model;

import dev.devanks.riverflow.daily.exception.BatchCommitException;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class BatchOutcome {

    int batchNumber;
    int operationCount;
    Set<String> stationKeys;
    BatchCommitException error; // null when committed

    public boolean isCommitted() {
        return error == null;
    }
}
