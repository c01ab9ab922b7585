package dev.devanks.riverflow.core.exception;

import dev.devanks.riverflow.core.model.ErrorType;

/**
 * Transport-level failure talking to the upstream provider (timeout, IO, non-2xx).
 * Retryable by re-running the job.
 */
public class FetchException extends StationDataException {

    public FetchException(String message) {
        super(ErrorType.FETCH_ERROR, message);
    }

    public FetchException(String message, Throwable cause) {
        super(ErrorType.FETCH_ERROR, message, cause);
    }
}
