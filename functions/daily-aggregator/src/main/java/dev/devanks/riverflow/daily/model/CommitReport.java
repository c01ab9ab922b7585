package dev.devanks.riverflow.daily.model;

import dev.devanks.riverflow.daily.exception.BatchCommitException;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a completed committer flushed, one entry per batch in commit order.
 */
@Value
public class CommitReport {

    List<BatchOutcome> batches;

    public int getCommitCount() {
        return (int) batches.stream().filter(BatchOutcome::isCommitted).count();
    }

    public int getFailedBatchCount() {
        return batches.size() - getCommitCount();
    }

    public int getOperationCount() {
        return batches.stream().mapToInt(BatchOutcome::getOperationCount).sum();
    }

    /**
     * Station keys with at least one operation in a failed batch, mapped to the first failure.
     */
    public Map<String, BatchCommitException> getFailedStations() {
        Map<String, BatchCommitException> failed = new LinkedHashMap<>();
        batches.stream()
                .filter(batch -> !batch.isCommitted())
                .forEach(batch -> batch.getStationKeys().forEach(key -> failed.putIfAbsent(key, batch.getError())));
        return failed;
    }
}
