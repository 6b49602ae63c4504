package com.eyelevel.uploadqueue.exception.apiclient;

import java.io.Serial;

/**
 * The ingestion service could not be reached or failed on its side (connect errors, timeouts, 5xx).
 * While polling, this is treated as transient.
 */
public class IngestionUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7351019930522719158L;

    public IngestionUnavailableException(String message, int statusCode) {
        super(message, statusCode);
    }

    public IngestionUnavailableException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
