package dev.devanks.riverflow.core.model;

public enum ErrorType {
    FETCH_ERROR,
    WRITE_ERROR,
    STORE_READ_ERROR,
    BATCH_COMMIT_ERROR,
    CATALOG_ERROR,
    UNEXPECTED_ERROR
}
