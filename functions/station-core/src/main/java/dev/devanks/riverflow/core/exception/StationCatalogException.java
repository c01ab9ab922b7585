package dev.devanks.riverflow.core.exception;

import dev.devanks.riverflow.core.model.ErrorType;

/**
 * The station catalog could not be loaded. Fatal: a run aborts before fan-out.
 */
public class StationCatalogException extends StationDataException {

    public StationCatalogException(String message) {
        super(ErrorType.CATALOG_ERROR, message);
    }
}
