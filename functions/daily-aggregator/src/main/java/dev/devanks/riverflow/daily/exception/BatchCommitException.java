package dev.devanks.riverflow.daily.exception;

import dev.devanks.riverflow.core.exception.StationDataException;
import dev.devanks.riverflow.core.model.ErrorType;

public class BatchCommitException extends StationDataException {

    public BatchCommitException(String message, Throwable cause) {
        super(ErrorType.BATCH_COMMIT_ERROR, message, cause);
    }
}
