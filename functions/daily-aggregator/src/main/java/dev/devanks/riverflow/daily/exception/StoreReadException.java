package dev.devanks.riverflow.daily.exception;

import dev.devanks.riverflow.core.exception.StationDataException;
import dev.devanks.riverflow.core.model.ErrorType;

public class StoreReadException extends StationDataException {

    public StoreReadException(String message, Throwable cause) {
        super(ErrorType.STORE_READ_ERROR, message, cause);
    }
}
