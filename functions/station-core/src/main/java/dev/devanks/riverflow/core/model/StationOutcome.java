package dev.devanks.riverflow.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.devanks.riverflow.core.exception.StationDataException;
import lombok.Builder;
import lombok.Data;

@Data
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL) // errorType/errorDetails only on failure
public class StationOutcome {

    public enum Status {
        SUCCESS, SKIPPED, FAILURE
    }

    private String stationKey;
    private Status status;
    private Integer readingCount;
    private String message;
    private ErrorType errorType;
    private String errorDetails;

    public static StationOutcome success(String stationKey, int readingCount, String message) {
        return StationOutcome.builder()
                .stationKey(stationKey)
                .status(Status.SUCCESS)
                .readingCount(readingCount)
                .message(message)
                .build();
    }

    public static StationOutcome skipped(String stationKey, String message) {
        return StationOutcome.builder()
                .stationKey(stationKey)
                .status(Status.SKIPPED)
                .readingCount(0)
                .message(message)
                .build();
    }

    public static StationOutcome failure(String stationKey, Throwable error) {
        ErrorType errorType = (error instanceof StationDataException)
                ? ((StationDataException) error).getErrorType()
                : ErrorType.UNEXPECTED_ERROR;
        return StationOutcome.builder()
                .stationKey(stationKey)
                .status(Status.FAILURE)
                .errorType(errorType)
                .errorDetails(error.getMessage())
                .build();
    }

    public boolean isFailure() {
        return status == Status.FAILURE;
    }
}
