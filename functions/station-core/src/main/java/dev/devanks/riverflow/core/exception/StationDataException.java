package dev.devanks.riverflow.core.exception;

import dev.devanks.riverflow.core.model.ErrorType;
import lombok.Getter;

/**
 * Base type for failures that are reported per station (or per batch) in a run report.
 */
@Getter
public class StationDataException extends RuntimeException {

    private final ErrorType errorType;

    public StationDataException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public StationDataException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
