package com.eyelevel.uploadqueue.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors raised while talking to the ingestion service.
 *
 * <p>Carries the HTTP status code of the failed exchange, or a synthetic 5xx code when no response was
 * received at all.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 2907361846624210418L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
