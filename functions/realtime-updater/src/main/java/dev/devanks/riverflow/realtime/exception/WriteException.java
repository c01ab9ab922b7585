// functions/realtime-updater/src/main/java/dev/devanks/riverflow/realtime/exception/WriteException.java
package dev.devanks.riverflow.realtime.exception;

import dev.devanks.riverflow.core.exception.StationDataException;
import dev.devanks.riverflow.core.model.ErrorType;

public class WriteException extends StationDataException {

    public WriteException(String message, Throwable cause) {
        super(ErrorType.WRITE_ERROR, message, cause);
    }
}
