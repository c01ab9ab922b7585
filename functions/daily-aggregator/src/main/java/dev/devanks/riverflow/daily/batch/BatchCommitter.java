package dev.devanks.riverflow.daily.batch;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import com.google.cloud.firestore.WriteBatch;
import com.google.cloud.firestore.WriteResult;
import dev.devanks.riverflow.daily.exception.BatchCommitException;
import dev.devanks.riverflow.daily.model.BatchOperation;
import dev.devanks.riverflow.daily.model.BatchOutcome;
import dev.devanks.riverflow.daily.model.CommitReport;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Groups merge writes into Firestore write batches of at most {@link #MAX_OPERATIONS_PER_BATCH}
 * operations. Each batch commits atomically; a failed batch is recorded and the committer carries
 * on with a fresh one. Operations queued together through {@link #enqueueAll(List)} always land in
 * the same batch.
 * <p>
 * A batch whose commit exceeds the timeout is reported as failed, but it is not rolled back:
 * Firestore may still apply it afterwards, so its state in the store is unknown. Every operation
 * is an idempotent merge, so the next run converges either way.
 * <p>
 * Not thread-safe. One instance serves one run and is discarded after {@link #complete()}.
 */
@Slf4j
public class BatchCommitter {

    /**
     * Firestore rejects write batches with more operations than this.
     */
    public static final int MAX_OPERATIONS_PER_BATCH = 500;

    enum State {
        ACCUMULATING, FLUSHING, COMPLETED
    }

    private final Firestore firestore;
    private final Duration commitTimeout;

    private final List<BatchOperation> pending = new ArrayList<>();
    private final List<BatchOutcome> outcomes = new ArrayList<>();
    private State state = State.ACCUMULATING;
    private CommitReport report;

    public BatchCommitter(Firestore firestore, Duration commitTimeout) {
        this.firestore = firestore;
        this.commitTimeout = commitTimeout;
    }

    /**
     * Queues one merge operation, committing the pending batch once it reaches the ceiling.
     *
     * @throws IllegalStateException after {@link #complete()}
     */
    public void enqueue(BatchOperation operation) {
        checkOpen(operation);
        pending.add(operation);
        if (pending.size() >= MAX_OPERATIONS_PER_BATCH) {
            flush();
        }
    }

    /**
     * Queues a group of operations that must commit together. When the group does not fit into
     * the pending batch, the pending batch is committed first so the group starts a fresh one.
     * A group larger than {@link #MAX_OPERATIONS_PER_BATCH} cannot be atomic and is split in order.
     *
     * @throws IllegalStateException after {@link #complete()}
     */
    public void enqueueAll(List<BatchOperation> group) {
        if (group.isEmpty()) {
            return;
        }
        checkOpen(group.get(0));
        if (!pending.isEmpty() && pending.size() + group.size() > MAX_OPERATIONS_PER_BATCH) {
            flush();
        }
        if (group.size() > MAX_OPERATIONS_PER_BATCH) {
            log.warn("Group of {} operations for {} exceeds the batch ceiling and will span several batches.",
                    group.size(), group.get(0).getStationKey());
        }
        group.forEach(this::enqueue);
    }

    /**
     * Commits whatever is still pending and closes the committer. Calling it again returns the
     * same report.
     */
    public CommitReport complete() {
        if (state == State.COMPLETED) {
            return report;
        }
        if (!pending.isEmpty()) {
            flush();
        }
        state = State.COMPLETED;
        report = new CommitReport(List.copyOf(outcomes));
        log.info("Batch committer completed: {} batches committed, {} failed, {} operations total.",
                report.getCommitCount(), report.getFailedBatchCount(), report.getOperationCount());
        return report;
    }

    private void checkOpen(BatchOperation operation) {
        if (state == State.COMPLETED) {
            throw new IllegalStateException("Committer already completed; cannot enqueue " + operation.getDocumentPath());
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    State state() {
        return state;
    }

    private void flush() {
        state = State.FLUSHING;
        int batchNumber = outcomes.size() + 1;
        List<BatchOperation> operations = List.copyOf(pending);
        pending.clear();

        var stationKeys = new LinkedHashSet<String>();
        operations.forEach(op -> stationKeys.add(op.getStationKey()));

        BatchCommitException error = null;
        try {
            WriteBatch batch = firestore.batch();
            for (BatchOperation op : operations) {
                batch.set(firestore.document(op.getDocumentPath()), op.getFields(), SetOptions.merge());
            }
            log.debug("Committing batch #{} with {} operations for {} stations.", batchNumber, operations.size(), stationKeys.size());
            List<WriteResult> results = batch.commit().get(commitTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Committed batch #{} ({} writes).", batchNumber, results == null ? operations.size() : results.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = commitFailure(batchNumber, operations.size(), e);
        } catch (ExecutionException e) {
            error = commitFailure(batchNumber, operations.size(), e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            error = commitFailure(batchNumber, operations.size(), e);
        }

        outcomes.add(BatchOutcome.builder()
                .batchNumber(batchNumber)
                .operationCount(operations.size())
                .stationKeys(Set.copyOf(stationKeys))
                .error(error)
                .build());
        state = State.ACCUMULATING;
    }

    private BatchCommitException commitFailure(int batchNumber, int operationCount, Throwable cause) {
        log.error("Batch #{} with {} operations failed to commit: {}", batchNumber, operationCount, cause.getMessage(), cause);
        return new BatchCommitException(
                "Batch #" + batchNumber + " (" + operationCount + " operations) failed to commit: " + cause.getMessage(), cause);
    }
}
